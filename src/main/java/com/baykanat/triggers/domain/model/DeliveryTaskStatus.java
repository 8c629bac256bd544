package com.baykanat.triggers.domain.model;

import java.util.Arrays;

public enum DeliveryTaskStatus {
    PENDING("pending"),
    IN_FLIGHT("in_flight"),
    SUCCEEDED("succeeded"),
    DEAD_LETTERED("dead_lettered"),
    CANCELLED("cancelled");

    private final String value;

    DeliveryTaskStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static DeliveryTaskStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown delivery task status: " + value));
    }
}
