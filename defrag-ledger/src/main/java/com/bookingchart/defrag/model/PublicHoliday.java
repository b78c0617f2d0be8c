package com.bookingchart.defrag.model;

import java.time.LocalDate;

public record PublicHoliday(LocalDate date, String name) {}
