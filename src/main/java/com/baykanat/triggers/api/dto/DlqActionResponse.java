package com.baykanat.triggers.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Retry veya dismiss sonrası etkilenen subscription'lar. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DlqActionResponse {

    @JsonProperty("event_id")
    private String eventId;

    /** retried | dismissed */
    private String action;

    @JsonProperty("subscription_ids")
    private List<String> subscriptionIds;
}
