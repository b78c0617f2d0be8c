package com.bookingchart.defrag.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HolidayType {
    PUBLIC, SCHOOL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static HolidayType fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
