package com.baykanat.triggers.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** events-ingestion topic mesajı; sadece id taşır, event içeriği DB'den okunur. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventEnvelope {

    @JsonProperty("event_id")
    private String eventId;

    @JsonProperty("account_id")
    private String accountId;

    @JsonProperty("correlation_id")
    private String correlationId;
}
