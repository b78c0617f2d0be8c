package com.bookingchart.defrag.service;

import com.bookingchart.defrag.model.RegionCode;
import com.bookingchart.defrag.model.SchoolHoliday;

import java.util.List;

/**
 * Pull-based, read-only school holiday calendar.
 *
 * Implementations may throw {@link com.bookingchart.defrag.exception.UpstreamUnavailableException}.
 */
public interface SchoolHolidaySource {

    List<SchoolHoliday> fetchSchoolHolidays(RegionCode region, int year);
}
