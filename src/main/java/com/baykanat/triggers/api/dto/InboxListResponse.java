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
@Schema(description = "Leased inbox page")
public class InboxListResponse {

    private List<InboxItemResponse> items;

    @JsonProperty("next_cursor")
    @Schema(description = "Opaque cursor for the next page; null when the page was not full")
    private String nextCursor;

    @JsonProperty("visibility_timeout")
    private int visibilityTimeout;
}
