package com.baykanat.triggers.domain.model;

import java.util.Arrays;

/** Event teslim durumu; normal akışta sadece ileri yönde ilerler. */
public enum EventStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    DELIVERED("delivered"),
    PARTIALLY_DELIVERED("partially_delivered"),
    FAILED("failed");

    private final String value;

    EventStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static EventStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown event status: " + value));
    }
}
