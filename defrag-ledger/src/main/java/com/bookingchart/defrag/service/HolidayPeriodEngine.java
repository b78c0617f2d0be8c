package com.bookingchart.defrag.service;

import com.bookingchart.defrag.config.DefragProperties;
import com.bookingchart.defrag.model.HolidayPeriod;
import com.bookingchart.defrag.model.PublicHoliday;
import com.bookingchart.defrag.model.RegionCode;
import com.bookingchart.defrag.model.SchoolHoliday;
import com.bookingchart.defrag.model.StayRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Merges public and school holiday calendars into labelled periods per region,
 * and picks the period a move should be tagged with.
 *
 * Calendars for a given (region, year) never change, so successful fetches are cached
 * for the life of the process. Failed fetches are not cached and degrade to an empty
 * result: holiday enrichment is best-effort and must never block move creation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HolidayPeriodEngine {

    /** Ascending start, then most important first, then name for a stable order. */
    static final Comparator<HolidayPeriod> PERIOD_ORDER = Comparator
            .comparing(HolidayPeriod::startDate)
            .thenComparing(p -> -p.importance().rank())
            .thenComparing(HolidayPeriod::name);

    /** Most important first; ties go to the earliest start, then name. */
    static final Comparator<HolidayPeriod> TAG_PRIORITY = Comparator
            .comparing((HolidayPeriod p) -> -p.importance().rank())
            .thenComparing(HolidayPeriod::startDate)
            .thenComparing(HolidayPeriod::name);

    private final PublicHolidaySource publicHolidaySource;
    private final SchoolHolidaySource schoolHolidaySource;
    private final DefragProperties properties;

    private final Map<CacheKey, List<PublicHoliday>> publicCache = new ConcurrentHashMap<>();
    private final Map<CacheKey, List<SchoolHoliday>> schoolCache = new ConcurrentHashMap<>();

    /**
     * Public holidays for a region and year, deduplicated and ascending by date.
     * Empty when the calendar source is unavailable.
     */
    public List<PublicHoliday> publicHolidays(RegionCode region, int year) {
        if (region == null) return List.of();
        return cached(publicCache, new CacheKey(region, year), "public", () ->
                publicHolidaySource.fetchPublicHolidays(region, year).stream()
                        .distinct()
                        .sorted(Comparator.comparing(PublicHoliday::date).thenComparing(PublicHoliday::name))
                        .toList());
    }

    /**
     * School holiday ranges for a region and year, ascending by start date.
     * Empty when the calendar source is unavailable.
     */
    public List<SchoolHoliday> schoolHolidays(RegionCode region, int year) {
        if (region == null) return List.of();
        return cached(schoolCache, new CacheKey(region, year), "school", () ->
                schoolHolidaySource.fetchSchoolHolidays(region, year).stream()
                        .distinct()
                        .sorted(Comparator.comparing(SchoolHoliday::startDate).thenComparing(SchoolHoliday::name))
                        .toList());
    }

    /**
     * All public and school periods whose start date lies in [fromDate, fromDate + windowDays),
     * sorted ascending by start date. Overlapping periods of different type are kept as
     * separate entries. Windows longer than {@code defrag.holidays.max-window-days} are clamped.
     */
    public List<HolidayPeriod> combinedForwardPeriods(RegionCode region, LocalDate fromDate, int windowDays) {
        if (region == null || fromDate == null || windowDays <= 0) return List.of();

        int maxDays = properties.getHolidays().getMaxWindowDays();
        if (windowDays > maxDays) {
            log.warn("Holiday window of {} days for {} clamped to {}", windowDays, region, maxDays);
            windowDays = maxDays;
        }
        LocalDate endExclusive = fromDate.plusDays(windowDays);
        int lastYear = endExclusive.minusDays(1).getYear();

        List<HolidayPeriod> periods = Stream.iterate(fromDate.getYear(), y -> y <= lastYear, y -> y + 1)
                .flatMap(year -> Stream.concat(
                        publicHolidays(region, year).stream().map(h -> HolidayPeriod.publicHoliday(h, region)),
                        schoolHolidays(region, year).stream().map(h -> HolidayPeriod.schoolHoliday(h, region))))
                .filter(p -> !p.startDate().isBefore(fromDate) && p.startDate().isBefore(endExclusive))
                .distinct()
                .sorted(PERIOD_ORDER)
                .toList();

        log.debug("{} holiday periods for {} between {} and {}", periods.size(), region, fromDate, endExclusive);
        return periods;
    }

    /**
     * The period a move over {@code stay} should be tagged with: the most important
     * overlapping period, earliest start on ties. Empty when nothing overlaps.
     */
    public Optional<HolidayPeriod> selectTag(List<HolidayPeriod> periods, StayRange stay) {
        if (periods == null || stay == null) return Optional.empty();
        return periods.stream()
                .filter(p -> p.overlaps(stay))
                .min(TAG_PRIORITY);
    }

    public Map<String, Object> cacheStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("publicEntries", publicCache.size());
        stats.put("schoolEntries", schoolCache.size());
        stats.put("publicKeys", keys(publicCache));
        stats.put("schoolKeys", keys(schoolCache));
        return stats;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private <T> List<T> cached(Map<CacheKey, List<T>> cache, CacheKey key, String kind, Supplier<List<T>> fetch) {
        List<T> hit = cache.get(key);
        if (hit != null) {
            return hit;
        }
        try {
            List<T> fetched = fetch.get();
            List<T> previous = cache.putIfAbsent(key, fetched);
            return previous != null ? previous : fetched;
        } catch (RuntimeException e) {
            log.warn("Holiday calendar unavailable ({} {} {}), continuing without it: {}",
                    kind, key.region(), key.year(), e.getMessage());
            return List.of();
        }
    }

    private List<String> keys(Map<CacheKey, ?> cache) {
        return cache.keySet().stream()
                .map(k -> k.region() + "_" + k.year())
                .sorted()
                .collect(Collectors.toList());
    }

    private record CacheKey(RegionCode region, int year) {}
}
