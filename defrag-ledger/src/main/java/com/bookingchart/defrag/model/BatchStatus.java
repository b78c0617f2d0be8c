package com.bookingchart.defrag.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BatchStatus {
    PENDING, PROCESSING, COMPLETED, FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BatchStatus fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
