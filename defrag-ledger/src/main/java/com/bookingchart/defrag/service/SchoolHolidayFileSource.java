package com.bookingchart.defrag.service;

import com.bookingchart.defrag.config.DefragProperties;
import com.bookingchart.defrag.exception.UpstreamUnavailableException;
import com.bookingchart.defrag.model.RegionCode;
import com.bookingchart.defrag.model.SchoolHoliday;
import com.bookingchart.defrag.model.SchoolHolidayCalendar;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads school holidays from the published calendar document
 * (defrag.holidays.school-calendar, classpath or file location).
 *
 * The document is re-read on every call; results are cached one level up per (region, year).
 * A range belongs to a year when it starts or ends in that year.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SchoolHolidayFileSource implements SchoolHolidaySource {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final DefragProperties properties;

    @Override
    public List<SchoolHoliday> fetchSchoolHolidays(RegionCode region, int year) {
        SchoolHolidayCalendar calendar = loadCalendar();

        List<SchoolHoliday> holidays = new ArrayList<>();
        for (SchoolHolidayCalendar.Term term : calendar.getTerms()) {
            String termName = term.getTerm() != null ? term.getTerm() : "Unknown Term";

            for (SchoolHolidayCalendar.Range range : term.getRanges()) {
                if (range.getState() == null || !range.getState().trim().equalsIgnoreCase(region.name())) {
                    continue;
                }
                SchoolHoliday holiday = toSchoolHoliday(termName, range);
                if (holiday == null) continue;

                if (holiday.startDate().getYear() == year || holiday.endDate().getYear() == year) {
                    holidays.add(holiday);
                }
            }
        }

        log.info("Found {} school holiday periods for {} in {}", holidays.size(), region, year);
        return holidays;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private SchoolHolidayCalendar loadCalendar() {
        String location = properties.getHolidays().getSchoolCalendar();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new UpstreamUnavailableException("School holiday calendar not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            SchoolHolidayCalendar calendar = objectMapper.readValue(in, SchoolHolidayCalendar.class);
            if (calendar == null || calendar.getTerms() == null) {
                throw new UpstreamUnavailableException("School holiday calendar has no terms: " + location);
            }
            return calendar;
        } catch (IOException e) {
            throw new UpstreamUnavailableException("Could not read school holiday calendar " + location, e);
        }
    }

    private SchoolHoliday toSchoolHoliday(String termName, SchoolHolidayCalendar.Range range) {
        if (range.getStart() == null || range.getEnd() == null) {
            log.warn("Skipping {} {}: missing start or end", termName, range.getState());
            return null;
        }
        try {
            LocalDate start = LocalDate.parse(range.getStart());
            LocalDate end = LocalDate.parse(range.getEnd());
            if (end.isBefore(start)) {
                log.warn("Skipping {} {}: end {} before start {}", termName, range.getState(), end, start);
                return null;
            }
            return new SchoolHoliday(termName + " School Holidays", start, end);
        } catch (DateTimeParseException e) {
            log.warn("Error parsing school holiday date for {} {}: {}", termName, range.getState(), e.getMessage());
            return null;
        }
    }
}
