package com.baykanat.triggers.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Inbox listesinde kiralanmış event + receipt token. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboxItem {

    private Event event;
    private String receiptToken;
    private Instant visibleUntil;
}
