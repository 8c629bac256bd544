package com.baykanat.triggers.api.dto;

import com.baykanat.triggers.domain.model.RateLimitDecision;
import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Batch yanıtı: öğe bazlı sonuçlar + özet. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Per-entry batch results")
public class BatchEventResponse {

    private List<BatchItemResult> results;

    private Summary summary;

    /** Son öğenin rate limit durumu; header'lara yazılır, gövdeye değil. */
    @JsonIgnore
    private RateLimitDecision rateLimit;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private int total;
        private int successful;
        private int failed;
        private int skipped;
    }
}
