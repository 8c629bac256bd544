package com.baykanat.triggers.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DlqItemResponse {

    @JsonProperty("event_id")
    private String eventId;

    @JsonProperty("subscription_id")
    private String subscriptionId;

    @JsonProperty("task_id")
    private String taskId;

    @JsonProperty("event_type")
    private String eventType;

    @JsonProperty("failure_reason")
    private String failureReason;

    @JsonProperty("retry_count")
    private int retryCount;

    @JsonProperty("created_at")
    private Instant createdAt;
}
