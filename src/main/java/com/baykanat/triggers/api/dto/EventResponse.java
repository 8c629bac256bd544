package com.baykanat.triggers.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Saklanan event görünümü; data ve metadata JSONB'den olduğu gibi yazılır. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Stored event")
public class EventResponse {

    @Schema(description = "Event identifier", example = "evt_01J9Z3K8W6T2V4X5Y7Z8A9B0C1")
    private String id;

    @Schema(example = "order.created")
    private String type;

    @Schema(example = "shop")
    private String source;

    @JsonRawValue
    @Schema(description = "Opaque event payload", type = "object")
    private String data;

    @JsonRawValue
    @Schema(description = "Event metadata", type = "object")
    private String metadata;

    @Schema(description = "Delivery status", example = "pending")
    private String status;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("matched_subscriptions")
    private int matchedSubscriptions;

    @JsonProperty("delivery_attempts")
    private int deliveryAttempts;

    @JsonProperty("successful_deliveries")
    private int successfulDeliveries;

    @JsonProperty("failed_deliveries")
    private int failedDeliveries;

    @JsonProperty("replay_count")
    private int replayCount;
}
