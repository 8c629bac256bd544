package com.baykanat.triggers.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Replay outcome")
public class ReplayResponse {

    @JsonProperty("event_id")
    private String eventId;

    @JsonProperty("dry_run")
    private boolean dryRun;

    @JsonProperty("causation_id")
    private String causationId;

    @JsonProperty("replay_count")
    private Integer replayCount;

    @JsonProperty("tasks_created")
    private int tasksCreated;

    @JsonProperty("payload_modified")
    private boolean payloadModified;

    @JsonProperty("metadata_modified")
    private boolean metadataModified;

    private List<Target> subscriptions;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Target {
        @JsonProperty("subscription_id")
        private String subscriptionId;
        private String url;
    }
}
