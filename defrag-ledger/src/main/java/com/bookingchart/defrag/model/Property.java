package com.bookingchart.defrag.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * A managed accommodation property. Never deleted, only deactivated.
 */
@Data
@Builder
public class Property {

    /** Short property code, unique, e.g. "CALI" */
    private String code;

    private String name;

    /** Id of the property in the upstream PMS */
    private String externalRef;

    /** Null until the region classifier resolves one */
    private RegionCode regionCode;

    private boolean active;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
