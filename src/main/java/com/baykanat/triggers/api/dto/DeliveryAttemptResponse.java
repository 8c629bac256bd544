package com.baykanat.triggers.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
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
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeliveryAttemptResponse {

    @JsonProperty("attempt_number")
    private int attemptNumber;

    private boolean success;

    @JsonProperty("status_code")
    private Integer statusCode;

    @JsonProperty("error_type")
    private String errorType;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("latency_ms")
    private long latencyMs;

    @JsonProperty("attempted_at")
    private Instant attemptedAt;
}
