package com.baykanat.triggers.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Her HTTP çağrısı için bir satır; append-only audit. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryAttempt {

    private Long id;
    private String eventId;
    private String subscriptionId;
    private String taskId;
    private int attemptNumber;
    private boolean success;
    private Integer statusCode;
    private String errorType;
    private String errorMessage;
    private String responseBody;
    private long latencyMs;
    private Instant attemptedAt;
}
