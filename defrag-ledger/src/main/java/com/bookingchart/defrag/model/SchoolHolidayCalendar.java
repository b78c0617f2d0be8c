package com.bookingchart.defrag.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * School holiday calendar document:
 * <pre>
 * {"year": 2025, "source": "...", "terms": [
 *     {"term": "Term 1", "ranges": [{"state": "VIC", "start": "2025-04-05", "end": "2025-04-21"}]}
 * ]}
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SchoolHolidayCalendar {

    private Integer year;
    private String source;
    private List<Term> terms = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Term {
        private String term;
        private List<Range> ranges = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Range {
        private String state;
        private String start;
        private String end;
    }
}
