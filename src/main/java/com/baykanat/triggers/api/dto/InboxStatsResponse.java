package com.baykanat.triggers.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/** visible: kiralanabilir, in_flight: lease'i açık, total: onaylanmamış tüm inbox event'leri. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboxStatsResponse {

    private int visible;

    @JsonProperty("in_flight")
    private int inFlight;

    private int total;

    @JsonProperty("oldest_event_at")
    private Instant oldestEventAt;

    @JsonProperty("by_event_type")
    private Map<String, Integer> byEventType;
}
