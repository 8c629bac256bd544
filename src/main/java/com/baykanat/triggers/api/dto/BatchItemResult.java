package com.baykanat.triggers.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchItemResult {

    public static final String CREATED = "created";
    public static final String REPLAYED = "replayed";
    public static final String FAILED = "failed";
    public static final String SKIPPED = "skipped";

    private int index;

    @JsonProperty("reference_id")
    private String referenceId;

    private boolean success;

    /** created | replayed | failed | skipped */
    private String outcome;

    private EventResponse event;

    private ItemError error;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ItemError {
        private String code;
        private String message;
        private String field;
    }
}
