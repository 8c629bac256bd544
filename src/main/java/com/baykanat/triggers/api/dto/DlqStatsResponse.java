package com.baykanat.triggers.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DlqStatsResponse {

    private int total;

    @JsonProperty("by_event_type")
    private Map<String, Integer> byEventType;
}
