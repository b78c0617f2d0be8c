package com.bookingchart.defrag.service;

import com.bookingchart.defrag.exception.NotFoundException;
import com.bookingchart.defrag.model.IngestSummary;
import com.bookingchart.defrag.model.Property;
import com.bookingchart.defrag.model.PropertyRecord;
import com.bookingchart.defrag.model.RegionCode;
import com.bookingchart.defrag.repository.LedgerUnitOfWork;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Property ingestion from the PMS and the only writer of a property's region.
 *
 * Each record is classified on its own; an unresolved region never blocks the record
 * from being stored, and an already known region is kept when a refresh cannot resolve one.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PropertyRegistry {

    private final LedgerUnitOfWork unitOfWork;
    private final RegionClassifier regionClassifier;
    private final Clock clock;

    public IngestSummary ingest(List<PropertyRecord> records) {
        List<PropertyRecord> valid = new ArrayList<>();
        int skipped = 0;
        for (PropertyRecord record : records) {
            if (record == null || isBlank(record.getCode()) || isBlank(record.getName())) {
                log.warn("Skipping property record without code or name: {}", record);
                skipped++;
                continue;
            }
            valid.add(record);
        }

        Map<String, Optional<RegionCode>> regions = regionClassifier.classifyAll(valid);
        LocalDateTime now = LocalDateTime.now(clock);
        int skippedRecords = skipped;

        IngestSummary summary = unitOfWork.execute("ingestProperties", ctx -> {
            int created = 0;
            int updated = 0;
            List<String> unresolved = new ArrayList<>();

            for (PropertyRecord record : valid) {
                String code = normaliseCode(record.getCode());
                Optional<Property> existing = ctx.properties().findByCode(code);

                RegionCode region = regions.getOrDefault(record.getCode(), Optional.empty())
                        .or(() -> existing.map(Property::getRegionCode))
                        .orElse(null);
                if (region == null) {
                    unresolved.add(code);
                }

                Property property = Property.builder()
                        .code(code)
                        .name(record.getName().trim())
                        .externalRef(record.getExternalRef())
                        .regionCode(region)
                        .active(record.isActive())
                        .build();

                if (ctx.properties().upsert(property, now)) {
                    created++;
                } else {
                    updated++;
                }
            }
            return new IngestSummary(created, updated, unresolved, skippedRecords);
        });

        log.info("Property ingestion complete: {} created, {} updated, {} skipped, {} without region",
                summary.created(), summary.updated(), summary.skipped(), summary.unresolved().size());
        return summary;
    }

    public Property find(String code) {
        String normalised = normaliseCode(code);
        return unitOfWork.read("findProperty", ctx -> ctx.properties().findByCode(normalised))
                .orElseThrow(() -> NotFoundException.property(normalised));
    }

    public List<Property> list(boolean activeOnly) {
        return unitOfWork.read("listProperties", ctx -> ctx.properties().findAll(activeOnly));
    }

    public List<RegionCode> activeRegions() {
        return unitOfWork.read("activeRegions", ctx -> ctx.properties().findActiveRegions());
    }

    public Property deactivate(String code) {
        String normalised = normaliseCode(code);
        LocalDateTime now = LocalDateTime.now(clock);
        Property property = unitOfWork.execute("deactivateProperty", ctx -> {
            if (!ctx.properties().setActive(normalised, false, now)) {
                throw NotFoundException.property(normalised);
            }
            return ctx.properties().findByCode(normalised).orElseThrow(() -> NotFoundException.property(normalised));
        });
        log.info("Property {} deactivated", normalised);
        return property;
    }

    static String normaliseCode(String code) {
        return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
