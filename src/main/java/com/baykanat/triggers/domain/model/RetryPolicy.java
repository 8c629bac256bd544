package com.baykanat.triggers.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Subscription bazlı retry politikası; gecikmeler milisaniye. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy {

    private int maxAttempts;
    private long initialDelayMs;
    private long maxDelayMs;
    private double multiplier;
}
