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

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Event ids whose DLQ items are retried or dismissed")
public class DlqBatchRequest {

    @NotEmpty(message = "event_ids must not be empty")
    @Size(max = 100, message = "Maximum 100 event ids per request")
    @JsonProperty("event_ids")
    private List<String> eventIds;
}
