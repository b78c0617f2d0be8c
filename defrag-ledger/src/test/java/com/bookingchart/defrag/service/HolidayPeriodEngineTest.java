package com.bookingchart.defrag.service;

import com.bookingchart.defrag.config.DefragProperties;
import com.bookingchart.defrag.exception.UpstreamUnavailableException;
import com.bookingchart.defrag.model.HolidayImportance;
import com.bookingchart.defrag.model.HolidayPeriod;
import com.bookingchart.defrag.model.HolidayType;
import com.bookingchart.defrag.model.PublicHoliday;
import com.bookingchart.defrag.model.RegionCode;
import com.bookingchart.defrag.model.SchoolHoliday;
import com.bookingchart.defrag.model.StayRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("HolidayPeriodEngine")
class HolidayPeriodEngineTest {

    private static final LocalDate LABOUR_DAY = LocalDate.of(2025, 3, 10);
    private static final LocalDate GOOD_FRIDAY = LocalDate.of(2025, 4, 18);
    private static final LocalDate EASTER_MONDAY = LocalDate.of(2025, 4, 21);

    @Mock
    private PublicHolidaySource publicSource;

    @Mock
    private SchoolHolidaySource schoolSource;

    private HolidayPeriodEngine engine;

    @BeforeEach
    void setUp() {
        DefragProperties properties = new DefragProperties();
        properties.getHolidays().setMaxWindowDays(400);
        engine = new HolidayPeriodEngine(publicSource, schoolSource, properties);
    }

    @Nested
    @DisplayName("calendar cache")
    class Cache {

        @Test
        @DisplayName("a successful fetch is cached per region and year")
        void cachesSuccessfulFetch() {
            when(publicSource.fetchPublicHolidays(RegionCode.VIC, 2025))
                    .thenReturn(List.of(new PublicHoliday(GOOD_FRIDAY, "Good Friday")));

            engine.publicHolidays(RegionCode.VIC, 2025);
            List<PublicHoliday> second = engine.publicHolidays(RegionCode.VIC, 2025);

            assertThat(second).extracting(PublicHoliday::name).containsExactly("Good Friday");
            verify(publicSource, times(1)).fetchPublicHolidays(RegionCode.VIC, 2025);
            assertThat(engine.cacheStats().get("publicKeys")).isEqualTo(List.of("VIC_2025"));
        }

        @Test
        @DisplayName("a failed fetch degrades to empty and is retried next time")
        void failureIsNotCached() {
            when(schoolSource.fetchSchoolHolidays(RegionCode.NSW, 2025))
                    .thenThrow(new UpstreamUnavailableException("calendar down"));

            assertThat(engine.schoolHolidays(RegionCode.NSW, 2025)).isEmpty();
            assertThat(engine.schoolHolidays(RegionCode.NSW, 2025)).isEmpty();

            verify(schoolSource, times(2)).fetchSchoolHolidays(RegionCode.NSW, 2025);
            assertThat(engine.cacheStats()).containsEntry("schoolEntries", 0);
        }

        @Test
        @DisplayName("duplicates are removed and results sorted by date")
        void dedupesAndSorts() {
            when(publicSource.fetchPublicHolidays(RegionCode.VIC, 2025)).thenReturn(List.of(
                    new PublicHoliday(EASTER_MONDAY, "Easter Monday"),
                    new PublicHoliday(GOOD_FRIDAY, "Good Friday"),
                    new PublicHoliday(GOOD_FRIDAY, "Good Friday")));

            assertThat(engine.publicHolidays(RegionCode.VIC, 2025))
                    .extracting(PublicHoliday::date)
                    .containsExactly(GOOD_FRIDAY, EASTER_MONDAY);
        }

        @Test
        @DisplayName("no region, no lookup")
        void nullRegion() {
            assertThat(engine.publicHolidays(null, 2025)).isEmpty();
            assertThat(engine.combinedForwardPeriods(null, GOOD_FRIDAY, 30)).isEmpty();
            verifyNoInteractions(publicSource, schoolSource);
        }
    }

    @Nested
    @DisplayName("combinedForwardPeriods")
    class ForwardPeriods {

        @Test
        @DisplayName("only periods starting inside the window, ascending by start")
        void windowAndOrder() {
            when(publicSource.fetchPublicHolidays(RegionCode.VIC, 2025)).thenReturn(List.of(
                    new PublicHoliday(LocalDate.of(2025, 1, 1), "New Year's Day"),
                    new PublicHoliday(EASTER_MONDAY, "Easter Monday"),
                    new PublicHoliday(LABOUR_DAY, "Labour Day"),
                    new PublicHoliday(GOOD_FRIDAY, "Good Friday"),
                    new PublicHoliday(LocalDate.of(2025, 12, 25), "Christmas Day")));
            when(schoolSource.fetchSchoolHolidays(RegionCode.VIC, 2025)).thenReturn(List.of(
                    new SchoolHoliday("Summer School Holidays", LocalDate.of(2024, 12, 21), LocalDate.of(2025, 1, 27)),
                    new SchoolHoliday("Term 1 School Holidays", LocalDate.of(2025, 4, 5), EASTER_MONDAY)));

            LocalDate from = LocalDate.of(2025, 3, 1);
            List<HolidayPeriod> periods = engine.combinedForwardPeriods(RegionCode.VIC, from, 60);

            assertThat(periods).extracting(HolidayPeriod::name).containsExactly(
                    "Labour Day", "Term 1 School Holidays", "Good Friday", "Easter Monday");
            assertThat(periods).allSatisfy(p -> {
                assertThat(p.startDate()).isAfterOrEqualTo(from);
                assertThat(p.startDate()).isBefore(from.plusDays(60));
                assertThat(p.regionCode()).isEqualTo(RegionCode.VIC);
            });
            assertThat(periods.get(1).type()).isEqualTo(HolidayType.SCHOOL);
            assertThat(periods.get(1).importance()).isEqualTo(HolidayImportance.MEDIUM);
        }

        @Test
        @DisplayName("window end is exclusive")
        void endExclusive() {
            when(publicSource.fetchPublicHolidays(RegionCode.VIC, 2025))
                    .thenReturn(List.of(new PublicHoliday(GOOD_FRIDAY, "Good Friday")));

            assertThat(engine.combinedForwardPeriods(RegionCode.VIC, GOOD_FRIDAY.minusDays(10), 10)).isEmpty();
            assertThat(engine.combinedForwardPeriods(RegionCode.VIC, GOOD_FRIDAY.minusDays(10), 11)).hasSize(1);
        }

        @Test
        @DisplayName("same start: more important first")
        void sameStartByImportance() {
            when(publicSource.fetchPublicHolidays(RegionCode.VIC, 2025))
                    .thenReturn(List.of(new PublicHoliday(GOOD_FRIDAY, "Good Friday")));
            when(schoolSource.fetchSchoolHolidays(RegionCode.VIC, 2025)).thenReturn(List.of(
                    new SchoolHoliday("Easter Break", GOOD_FRIDAY, GOOD_FRIDAY.plusDays(10))));

            assertThat(engine.combinedForwardPeriods(RegionCode.VIC, GOOD_FRIDAY, 5))
                    .extracting(HolidayPeriod::type)
                    .containsExactly(HolidayType.PUBLIC, HolidayType.SCHOOL);
        }

        @Test
        @DisplayName("a window across new year reads both years")
        void spansYears() {
            when(publicSource.fetchPublicHolidays(RegionCode.NSW, 2025))
                    .thenReturn(List.of(new PublicHoliday(LocalDate.of(2025, 12, 25), "Christmas Day")));
            when(publicSource.fetchPublicHolidays(RegionCode.NSW, 2026))
                    .thenReturn(List.of(new PublicHoliday(LocalDate.of(2026, 1, 1), "New Year's Day")));

            List<HolidayPeriod> periods =
                    engine.combinedForwardPeriods(RegionCode.NSW, LocalDate.of(2025, 12, 15), 30);

            assertThat(periods).extracting(HolidayPeriod::name).containsExactly("Christmas Day", "New Year's Day");
            verify(schoolSource).fetchSchoolHolidays(RegionCode.NSW, 2026);
        }

        @Test
        @DisplayName("an oversized window is clamped to the configured maximum")
        void clampsWindow() {
            engine.combinedForwardPeriods(RegionCode.WA, LocalDate.of(2025, 1, 1), 36_500_000);

            verify(publicSource).fetchPublicHolidays(RegionCode.WA, 2025);
            verify(publicSource).fetchPublicHolidays(RegionCode.WA, 2026);
            verify(publicSource, never()).fetchPublicHolidays(RegionCode.WA, 2027);
            assertThat(engine.cacheStats()).containsEntry("publicEntries", 2);
        }

        @Test
        @DisplayName("non-positive window is empty")
        void emptyWindow() {
            assertThat(engine.combinedForwardPeriods(RegionCode.VIC, GOOD_FRIDAY, 0)).isEmpty();
            verify(publicSource, never()).fetchPublicHolidays(any(), anyInt());
        }
    }

    @Nested
    @DisplayName("selectTag")
    class SelectTag {

        private final HolidayPeriod term1 = HolidayPeriod.of(
                "Term 1 School Holidays", HolidayType.SCHOOL, LocalDate.of(2025, 4, 5), EASTER_MONDAY, RegionCode.VIC);
        private final HolidayPeriod goodFriday = HolidayPeriod.of(
                "Good Friday", HolidayType.PUBLIC, GOOD_FRIDAY, GOOD_FRIDAY, RegionCode.VIC);
        private final HolidayPeriod easterMonday = HolidayPeriod.of(
                "Easter Monday", HolidayType.PUBLIC, EASTER_MONDAY, EASTER_MONDAY, RegionCode.VIC);

        private StayRange stay(String in, String out) {
            return new StayRange(LocalDate.parse(in), LocalDate.parse(out));
        }

        @Test
        @DisplayName("a public holiday beats an overlapping school period")
        void publicBeatsSchool() {
            assertThat(engine.selectTag(List.of(term1, goodFriday), stay("2025-04-17", "2025-04-20")))
                    .contains(goodFriday);
        }

        @Test
        @DisplayName("a multi-day public period is peak")
        void multiDayPublicIsPeak() {
            HolidayPeriod easter = HolidayPeriod.of(
                    "Easter Long Weekend", HolidayType.PUBLIC, GOOD_FRIDAY, EASTER_MONDAY, RegionCode.VIC);

            assertThat(easter.importance()).isEqualTo(HolidayImportance.PEAK);
            assertThat(HolidayPeriod.publicHoliday(new PublicHoliday(GOOD_FRIDAY, "Good Friday"), RegionCode.VIC)
                    .importance()).isEqualTo(HolidayImportance.HIGH);
            assertThat(engine.selectTag(List.of(goodFriday, term1, easter), stay("2025-04-17", "2025-04-20")))
                    .contains(easter);
        }

        @Test
        @DisplayName("equal importance: earliest start wins")
        void tieGoesToEarliest() {
            assertThat(engine.selectTag(List.of(easterMonday, goodFriday), stay("2025-04-17", "2025-04-23")))
                    .contains(goodFriday);
        }

        @Test
        @DisplayName("check-out day is not an occupied night")
        void checkOutExclusive() {
            assertThat(engine.selectTag(List.of(goodFriday, term1), stay("2025-04-16", "2025-04-18")))
                    .contains(term1);
        }

        @Test
        @DisplayName("nothing overlapping, no tag")
        void noOverlap() {
            assertThat(engine.selectTag(List.of(goodFriday, term1), stay("2025-05-10", "2025-05-12"))).isEmpty();
            assertThat(engine.selectTag(List.of(), stay("2025-04-17", "2025-04-20"))).isEmpty();
        }
    }

    @Test
    @DisplayName("cache stats report entries and keys")
    void cacheStats() {
        engine.publicHolidays(RegionCode.WA, 2026);
        engine.schoolHolidays(RegionCode.WA, 2026);

        Map<String, Object> stats = engine.cacheStats();

        assertThat(stats).containsEntry("publicEntries", 1).containsEntry("schoolEntries", 1);
        assertThat(stats.get("schoolKeys")).isEqualTo(List.of("WA_2026"));
    }
}
