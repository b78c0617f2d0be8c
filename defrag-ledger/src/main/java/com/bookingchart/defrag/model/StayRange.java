package com.bookingchart.defrag.model;

import java.time.LocalDate;

/**
 * Check-in / check-out of the booking a move relocates. Check-out is the departure day,
 * so the last occupied night is the day before (or check-in itself for same-day stays).
 */
public record StayRange(LocalDate checkIn, LocalDate checkOut) {

    public LocalDate lastNight() {
        return checkOut.isAfter(checkIn) ? checkOut.minusDays(1) : checkIn;
    }

    /** True when any occupied night falls inside the inclusive range [start, end]. */
    public boolean overlaps(LocalDate start, LocalDate end) {
        return !checkIn.isAfter(end) && !lastNight().isBefore(start);
    }
}
