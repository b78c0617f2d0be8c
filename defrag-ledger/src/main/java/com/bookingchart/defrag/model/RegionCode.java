package com.bookingchart.defrag.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Australian state and territory codes. Selects the holiday calendars for a property.
 */
public enum RegionCode {
    ACT, NSW, NT, QLD, SA, TAS, VIC, WA;

    /**
     * Case-insensitive lookup of a raw code. Blank or unknown input resolves to empty.
     */
    public static Optional<RegionCode> fromCode(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String normalised = raw.trim().toUpperCase(Locale.ROOT);
        for (RegionCode code : values()) {
            if (code.name().equals(normalised)) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }
}
