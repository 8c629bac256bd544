package com.baykanat.triggers.domain.model;

import java.util.Arrays;

public enum SubscriptionStatus {
    ACTIVE("active"),
    PAUSED("paused"),
    DISABLED("disabled");

    private final String value;

    SubscriptionStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static SubscriptionStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown subscription status: " + value));
    }
}
