package com.baykanat.triggers.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Tek ingestion sonucu; created=false ise mevcut event idempotent olarak döndü. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResult {

    private Event event;
    private boolean created;
    /** Idempotent tekrar için null (token tüketilmedi). */
    private RateLimitDecision rateLimit;
}
