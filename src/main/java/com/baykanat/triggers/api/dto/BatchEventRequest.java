package com.baykanat.triggers.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Toplu event isteği; öğeler tek tek doğrulanır, hatalı öğe batch'i durdurmaz. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Batch event ingestion payload")
public class BatchEventRequest {

    @NotEmpty(message = "events list must not be empty")
    @Size(max = 100, message = "Maximum 100 events per batch request")
    @Schema(description = "Events to ingest")
    private List<EventRequest> events;

    @JsonProperty("fail_fast")
    @Schema(description = "Stop at the first failed entry and report the rest as skipped", example = "false")
    private boolean failFast;
}
