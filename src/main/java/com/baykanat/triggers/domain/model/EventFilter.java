package com.baykanat.triggers.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** GET /events filtreleri; null alan filtre uygulanmaz demek. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventFilter {

    private String type;
    private String source;
    private EventStatus status;
    private Instant since;
    private Instant until;
}
