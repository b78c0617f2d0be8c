package com.bookingchart.defrag.model;

import java.time.LocalDate;

/**
 * Fixed importance ladder: multi-day public periods, then single public holidays, then school holidays.
 *
 * Calendar feeds publish public holidays as single dates, so {@link HolidayPeriod#publicHoliday}
 * always yields {@code HIGH}. {@code PEAK} is only reached by a public period built with a
 * multi-day range through {@link HolidayPeriod#of}.
 */
public enum HolidayImportance {
    MEDIUM(1),
    HIGH(2),
    PEAK(3);

    private final int rank;

    HolidayImportance(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public static HolidayImportance of(HolidayType type, LocalDate start, LocalDate end) {
        if (type == HolidayType.SCHOOL) return MEDIUM;
        return end.isAfter(start) ? PEAK : HIGH;
    }
}
