package com.bookingchart.defrag.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * APPLIED is set by the PMS write-back, which lives outside this service.
 */
public enum MoveStatus {
    PENDING, APPROVED, REJECTED, APPLIED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MoveStatus fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
