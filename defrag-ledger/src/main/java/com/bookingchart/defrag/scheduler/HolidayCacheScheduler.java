package com.bookingchart.defrag.scheduler;

import com.bookingchart.defrag.config.DefragProperties;
import com.bookingchart.defrag.model.RegionCode;
import com.bookingchart.defrag.service.HolidayPeriodEngine;
import com.bookingchart.defrag.service.PropertyRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Keeps the holiday calendars of every active region warm, for this year and the next,
 * so that batch creation rarely waits on the calendar source.
 *
 * Default schedule: daily at 03:00 UTC. Override with defrag.scheduling.cron.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HolidayCacheScheduler {

    private final HolidayPeriodEngine holidayEngine;
    private final PropertyRegistry propertyRegistry;
    private final DefragProperties properties;
    private final Clock clock;

    @PostConstruct
    public void onStartup() {
        if (properties.getScheduling().isWarmOnStartup()) {
            log.info("warm-on-startup=true, loading holiday calendars");
            warmCache();
        } else {
            log.info("Holiday cache ready. Next scheduled warm-up: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${defrag.scheduling.cron:0 0 3 * * ?}", zone = "UTC")
    public void scheduledWarmUp() {
        log.info("Scheduled holiday cache warm-up triggered");
        warmCache();
    }

    /** @return number of (region, year) pairs loaded */
    public int warmCache() {
        List<RegionCode> regions;
        try {
            regions = propertyRegistry.activeRegions();
        } catch (Exception e) {
            log.error("Holiday cache warm-up failed, could not list active regions: {}", e.getMessage(), e);
            return 0;
        }

        int year = LocalDate.now(clock).getYear();
        int loaded = 0;
        for (RegionCode region : regions) {
            for (int y = year; y <= year + 1; y++) {
                int publicCount = holidayEngine.publicHolidays(region, y).size();
                int schoolCount = holidayEngine.schoolHolidays(region, y).size();
                log.debug("Warmed {} {}: {} public, {} school", region, y, publicCount, schoolCount);
                loaded++;
            }
        }
        log.info("Holiday cache warm-up complete: {} regions, {} region-years", regions.size(), loaded);
        return loaded;
    }
}
