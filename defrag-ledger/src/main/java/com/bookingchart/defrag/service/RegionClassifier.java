package com.bookingchart.defrag.service;

import com.bookingchart.defrag.model.PropertyRecord;
import com.bookingchart.defrag.model.RegionCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves the state/territory of a property from whatever the PMS gave us.
 *
 * Rules, first hit wins:
 *  1. an explicit state field holding a known code
 *  2. a region-identifying keyword in the display name
 *  3. the first character of the property code (company naming convention)
 *
 * Pure: no I/O, no shared mutable state.
 */
@Component
@Slf4j
public class RegionClassifier {

    /** Record attributes that may carry a state code, in lookup order. */
    static final List<String> REGION_FIELDS = List.of("state", "stateCode", "region", "location", "address");

    /**
     * Place names ahead of state names ahead of bare abbreviations, so that
     * "Alice Springs" resolves to NT even when the code prefix says otherwise.
     */
    private static final List<Keyword> KEYWORDS = List.of(
            // NT
            kw("ALICE SPRINGS", RegionCode.NT),
            kw("DARWIN", RegionCode.NT),
            kw("KATHERINE", RegionCode.NT),
            kw("TENNANT CREEK", RegionCode.NT),
            kw("KAKADU", RegionCode.NT),
            kw("ULURU", RegionCode.NT),
            kw("YULARA", RegionCode.NT),
            // QLD
            kw("CAIRNS", RegionCode.QLD),
            kw("PORT DOUGLAS", RegionCode.QLD),
            kw("TOWNSVILLE", RegionCode.QLD),
            kw("AIRLIE BEACH", RegionCode.QLD),
            kw("WHITSUNDAY", RegionCode.QLD),
            kw("WHITSUNDAYS", RegionCode.QLD),
            kw("NOOSA", RegionCode.QLD),
            kw("SUNSHINE COAST", RegionCode.QLD),
            kw("GOLD COAST", RegionCode.QLD),
            kw("BRISBANE", RegionCode.QLD),
            kw("HERVEY BAY", RegionCode.QLD),
            // NSW
            kw("SYDNEY", RegionCode.NSW),
            kw("COOGEE", RegionCode.NSW),
            kw("BYRON BAY", RegionCode.NSW),
            kw("BLUE MOUNTAINS", RegionCode.NSW),
            kw("PORT MACQUARIE", RegionCode.NSW),
            kw("COFFS HARBOUR", RegionCode.NSW),
            kw("NEWCASTLE", RegionCode.NSW),
            // ACT
            kw("CANBERRA", RegionCode.ACT),
            // VIC
            kw("MELBOURNE", RegionCode.VIC),
            kw("PHILLIP ISLAND", RegionCode.VIC),
            kw("GREAT OCEAN ROAD", RegionCode.VIC),
            kw("GRAMPIANS", RegionCode.VIC),
            kw("BALLARAT", RegionCode.VIC),
            kw("BENDIGO", RegionCode.VIC),
            // TAS
            kw("HOBART", RegionCode.TAS),
            kw("LAUNCESTON", RegionCode.TAS),
            kw("CRADLE MOUNTAIN", RegionCode.TAS),
            kw("FREYCINET", RegionCode.TAS),
            // SA
            kw("ADELAIDE", RegionCode.SA),
            kw("BAROSSA", RegionCode.SA),
            kw("KANGAROO ISLAND", RegionCode.SA),
            kw("FLINDERS RANGES", RegionCode.SA),
            // WA
            kw("PERTH", RegionCode.WA),
            kw("BROOME", RegionCode.WA),
            kw("MARGARET RIVER", RegionCode.WA),
            kw("EXMOUTH", RegionCode.WA),
            kw("ROTTNEST", RegionCode.WA),
            kw("KALBARRI", RegionCode.WA),
            // Full state names
            kw("NORTHERN TERRITORY", RegionCode.NT),
            kw("AUSTRALIAN CAPITAL TERRITORY", RegionCode.ACT),
            kw("NEW SOUTH WALES", RegionCode.NSW),
            kw("QUEENSLAND", RegionCode.QLD),
            kw("VICTORIA", RegionCode.VIC),
            kw("TASMANIA", RegionCode.TAS),
            kw("SOUTH AUSTRALIA", RegionCode.SA),
            kw("WESTERN AUSTRALIA", RegionCode.WA),
            // Bare abbreviations, whole words only
            kw("ACT", RegionCode.ACT),
            kw("NSW", RegionCode.NSW),
            kw("NT", RegionCode.NT),
            kw("QLD", RegionCode.QLD),
            kw("SA", RegionCode.SA),
            kw("TAS", RegionCode.TAS),
            kw("VIC", RegionCode.VIC),
            kw("WA", RegionCode.WA)
    );

    private static final Map<Character, RegionCode> CODE_PREFIXES = Map.of(
            'V', RegionCode.VIC,
            'N', RegionCode.NSW,
            'Q', RegionCode.QLD,
            'S', RegionCode.SA,
            'T', RegionCode.TAS,
            'W', RegionCode.WA,
            'C', RegionCode.NT
    );

    /**
     * Classify a single record. Empty means unresolved; never throws for bad input.
     */
    public Optional<RegionCode> classify(PropertyRecord record) {
        if (record == null) return Optional.empty();

        Optional<RegionCode> explicit = fromExplicitField(record.getAttributes());
        if (explicit.isPresent()) return explicit;

        Optional<RegionCode> keyword = fromName(record.getName());
        if (keyword.isPresent()) return keyword;

        Optional<RegionCode> prefix = fromCodePrefix(record.getCode());
        if (prefix.isEmpty()) {
            log.warn("Could not resolve region for property {} ({})", record.getCode(), record.getName());
        }
        return prefix;
    }

    /**
     * Classify every record independently. A failure on one record is logged and
     * leaves that record unresolved; it never aborts the rest.
     *
     * @return property code → region (empty when unresolved), in input order
     */
    public Map<String, Optional<RegionCode>> classifyAll(List<PropertyRecord> records) {
        Map<String, Optional<RegionCode>> result = new LinkedHashMap<>();
        for (PropertyRecord record : records) {
            String key = record == null ? null : record.getCode();
            try {
                result.put(key, classify(record));
            } catch (RuntimeException e) {
                log.warn("Region classification failed for property {}: {}", key, e.getMessage(), e);
                result.put(key, Optional.empty());
            }
        }
        return result;
    }

    // ── Rules ────────────────────────────────────────────────────────────────

    Optional<RegionCode> fromExplicitField(Map<String, String> attributes) {
        if (attributes == null || attributes.isEmpty()) return Optional.empty();
        for (String field : REGION_FIELDS) {
            Optional<RegionCode> code = RegionCode.fromCode(attributes.get(field));
            if (code.isPresent()) {
                log.debug("Found region {} in field '{}'", code.get(), field);
                return code;
            }
        }
        return Optional.empty();
    }

    Optional<RegionCode> fromName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String upper = name.toUpperCase(Locale.ROOT);
        return KEYWORDS.stream()
                .filter(k -> k.pattern().matcher(upper).find())
                .map(Keyword::region)
                .findFirst();
    }

    Optional<RegionCode> fromCodePrefix(String code) {
        if (code == null || code.isBlank()) return Optional.empty();
        char first = Character.toUpperCase(code.trim().charAt(0));
        return Optional.ofNullable(CODE_PREFIXES.get(first));
    }

    private static Keyword kw(String keyword, RegionCode region) {
        Pattern pattern = Pattern.compile("(?<![A-Z0-9])" + Pattern.quote(keyword) + "(?![A-Z0-9])");
        return new Keyword(pattern, region);
    }

    private record Keyword(Pattern pattern, RegionCode region) {}
}
