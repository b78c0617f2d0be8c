package com.bookingchart.defrag.model;

import java.util.List;

/**
 * Outcome of one property ingestion run.
 *
 * @param unresolved codes of properties whose region could not be determined
 * @param skipped    records rejected for a missing code or name
 */
public record IngestSummary(int created, int updated, List<String> unresolved, int skipped) {}
