package com.bookingchart.defrag.service;

import com.bookingchart.defrag.config.DefragProperties;
import com.bookingchart.defrag.exception.UpstreamUnavailableException;
import com.bookingchart.defrag.model.NagerHoliday;
import com.bookingchart.defrag.model.PublicHoliday;
import com.bookingchart.defrag.model.RegionCode;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thin client over the date.nager.at public holiday API.
 *
 * One call per (country, year); regional holidays are filtered client-side using the
 * ISO 3166-2 subdivision list ("AU-VIC", ...). Nationwide holidays carry no subdivisions.
 * Transport failures and unreadable bodies surface as {@link UpstreamUnavailableException},
 * which the Resilience4j "holidayApi" instance retries a bounded number of times.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NagerDateClient implements PublicHolidaySource {

    private final RestTemplate restTemplate;
    private final DefragProperties properties;

    @Override
    @Retry(name = "holidayApi")
    public List<PublicHoliday> fetchPublicHolidays(RegionCode region, int year) {
        String country = properties.getHolidays().getCountryCode();
        String url = UriComponentsBuilder
                .fromHttpUrl(properties.getHolidays().getBaseUrl())
                .pathSegment("PublicHolidays", String.valueOf(year), country)
                .toUriString();

        NagerHoliday[] response = callApi(url, region, year);
        if (response == null) {
            return Collections.emptyList();
        }

        String subdivision = country + "-" + region.name();
        List<PublicHoliday> holidays = new ArrayList<>();
        for (NagerHoliday raw : response) {
            if (!appliesTo(raw, subdivision)) continue;
            PublicHoliday holiday = toPublicHoliday(raw);
            if (holiday != null) {
                holidays.add(holiday);
            }
        }

        log.info("Retrieved {} public holidays for {} {} ({} before regional filter)",
                holidays.size(), region, year, response.length);
        return holidays;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private NagerHoliday[] callApi(String url, RegionCode region, int year) {
        log.debug("Calling holiday API: {}", url);
        try {
            return restTemplate.getForObject(url, NagerHoliday[].class);

        } catch (HttpClientErrorException.NotFound e) {
            // 404 means no calendar published for that country/year
            log.debug("No holidays found (404) for URL: {}", url);
            return null;

        } catch (RestClientException e) {
            log.warn("Holiday API call failed for {} {}: {}", region, year, e.getMessage());
            throw new UpstreamUnavailableException("Holiday API unavailable for " + region + " " + year, e);
        }
    }

    private boolean appliesTo(NagerHoliday raw, String subdivision) {
        if (Boolean.TRUE.equals(raw.getGlobal())) return true;
        List<String> counties = raw.getCounties();
        return counties == null || counties.isEmpty() || counties.contains(subdivision);
    }

    private PublicHoliday toPublicHoliday(NagerHoliday raw) {
        String name = raw.getName() != null ? raw.getName() : raw.getLocalName();
        if (raw.getDate() == null || name == null || name.isBlank()) {
            log.warn("Skipping holiday entry with missing date or name: {}", raw);
            return null;
        }
        try {
            return new PublicHoliday(LocalDate.parse(raw.getDate()), name.trim());
        } catch (DateTimeParseException e) {
            log.warn("Invalid holiday date format: {}", raw.getDate());
            return null;
        }
    }
}
