package com.bookingchart.defrag.model;

import com.bookingchart.defrag.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MoveAction {
    APPROVE, REJECT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MoveAction fromValue(String value) {
        if (value == null) {
            throw new ValidationException("action is required (approve|reject)");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid action '" + value + "' (expected approve|reject)");
        }
    }
}
