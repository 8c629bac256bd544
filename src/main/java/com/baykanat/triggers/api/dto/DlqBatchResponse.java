package com.baykanat.triggers.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Her event bağımsız işlenir; başarısızlar results içinde error taşır. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DlqBatchResponse {

    private int total;

    private int successful;

    private int failed;

    private List<Result> results;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Result {

        @JsonProperty("event_id")
        private String eventId;

        private boolean success;

        @JsonProperty("subscription_ids")
        private List<String> subscriptionIds;

        private String error;
    }
}
