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
public class InboxVisibilityResponse {

    @JsonProperty("receipt_handle")
    private String receiptHandle;

    @JsonProperty("visible_until")
    private Instant visibleUntil;
}
