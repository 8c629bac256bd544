package com.baykanat.triggers.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Replay options")
public class ReplayRequest {

    @JsonProperty("dry_run")
    @Schema(description = "Only report the subscriptions that would receive the event", example = "true")
    private boolean dryRun;

    @Size(max = 100, message = "Maximum 100 target subscriptions")
    @JsonProperty("target_subscriptions")
    @Schema(description = "Restrict replay to these subscription ids")
    private List<String> targetSubscriptions;

    @JsonProperty("payload_override")
    @Schema(description = "Deep-merged into the event data for the replayed deliveries only",
            example = "{\"status\": \"corrected\"}")
    private Map<String, Object> payloadOverride;

    @JsonProperty("metadata_override")
    @Schema(description = "Deep-merged into the event metadata for the replayed deliveries only",
            example = "{\"replay_reason\": \"receiver fixed\"}")
    private Map<String, Object> metadataOverride;
}
