package com.bookingchart.defrag.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Raw DTO matching the date.nager.at PublicHolidays JSON structure.
 * Kept separate from the domain model to isolate API coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class NagerHoliday {

    /** yyyy-MM-dd */
    private String date;

    private String localName;

    private String name;

    private String countryCode;

    /** True for nationwide holidays */
    private Boolean global;

    /** ISO 3166-2 subdivisions, e.g. "AU-VIC". Null for nationwide holidays. */
    private List<String> counties;

    private List<String> types;
}
