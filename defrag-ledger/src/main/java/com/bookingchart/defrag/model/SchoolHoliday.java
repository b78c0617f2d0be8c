package com.bookingchart.defrag.model;

import java.time.LocalDate;

/** Inclusive school holiday range, e.g. "Term 1 School Holidays" 2025-04-05 .. 2025-04-21. */
public record SchoolHoliday(String name, LocalDate startDate, LocalDate endDate) {}
