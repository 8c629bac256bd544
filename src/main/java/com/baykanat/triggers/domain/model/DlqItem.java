package com.baykanat.triggers.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DlqItem {

    private String eventId;
    private String subscriptionId;
    private String taskId;
    private String accountId;
    private String eventType;
    private String failureReason;
    private int retryCount;
    private Instant createdAt;
}
