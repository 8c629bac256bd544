package com.baykanat.triggers.api.dto;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** GET /events/{id}: event + subscription bazlı teslim özeti. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Event with delivery summary")
public class EventDetailResponse {

    @JsonUnwrapped
    private EventResponse event;

    @Schema(description = "One entry per delivery task, including replays")
    private List<DeliverySummaryResponse> deliveries;
}
