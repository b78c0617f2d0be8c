package com.bookingchart.defrag.model;

import java.time.LocalDate;

/**
 * A labelled holiday period for one region. End date is inclusive.
 * Not persisted on its own: the winning period is copied onto the moves it tags.
 */
public record HolidayPeriod(
        String name,
        HolidayType type,
        HolidayImportance importance,
        LocalDate startDate,
        LocalDate endDate,
        RegionCode regionCode) {

    public static HolidayPeriod publicHoliday(PublicHoliday holiday, RegionCode region) {
        return of(holiday.name(), HolidayType.PUBLIC, holiday.date(), holiday.date(), region);
    }

    public static HolidayPeriod schoolHoliday(SchoolHoliday holiday, RegionCode region) {
        return of(holiday.name(), HolidayType.SCHOOL, holiday.startDate(), holiday.endDate(), region);
    }

    public static HolidayPeriod of(String name, HolidayType type, LocalDate start, LocalDate end, RegionCode region) {
        return new HolidayPeriod(name, type, HolidayImportance.of(type, start, end), start, end, region);
    }

    public boolean overlaps(StayRange stay) {
        return stay.overlaps(startDate, endDate);
    }
}
