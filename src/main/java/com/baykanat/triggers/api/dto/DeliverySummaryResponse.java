package com.baykanat.triggers.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeliverySummaryResponse {

    @JsonProperty("task_id")
    private String taskId;

    @JsonProperty("subscription_id")
    private String subscriptionId;

    private String status;

    @JsonProperty("attempt_number")
    private int attemptNumber;

    @JsonProperty("causation_id")
    private String causationId;

    @JsonProperty("last_error")
    private String lastError;

    private List<DeliveryAttemptResponse> attempts;
}
