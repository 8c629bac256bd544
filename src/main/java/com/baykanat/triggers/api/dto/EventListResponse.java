package com.baykanat.triggers.api.dto;

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
@Schema(description = "Events, newest first")
public class EventListResponse {

    private List<EventResponse> items;

    @JsonProperty("next_cursor")
    @Schema(description = "Opaque cursor for the next page; null on the last page")
    private String nextCursor;

    @JsonProperty("has_more")
    private boolean hasMore;
}
