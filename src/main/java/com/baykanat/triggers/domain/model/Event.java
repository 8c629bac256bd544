package com.baykanat.triggers.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** events tablosu satırı için domain model (JDBC, JPA değil). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Event {

    private String id;
    private String accountId;
    private String type;
    private String source;
    private String data;     // JSONB (String olarak)
    private String metadata; // JSONB (String olarak)
    private String idempotencyKey;
    private String correlationId;
    private EventStatus status;
    private int matchedSubscriptions;
    private int deliveryAttempts;
    private int successfulDeliveries;
    private int failedDeliveries;
    private int replayCount;
    private Instant createdAt;
    private Instant updatedAt;
}
