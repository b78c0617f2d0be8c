package com.bookingchart.defrag.service;

import com.bookingchart.defrag.model.PublicHoliday;
import com.bookingchart.defrag.model.RegionCode;

import java.util.List;

/**
 * Pull-based, read-only public holiday calendar.
 *
 * Implementations may throw {@link com.bookingchart.defrag.exception.UpstreamUnavailableException};
 * ordering and deduplication are left to the caller.
 */
public interface PublicHolidaySource {

    List<PublicHoliday> fetchPublicHolidays(RegionCode region, int year);
}
