package com.bookingchart.defrag.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Raw property record as received from the property management system.
 *
 * Field coverage varies between sources: some carry an explicit state field,
 * most only carry a code and a display name. Anything beyond code, name and
 * external reference is kept as loose string attributes.
 */
@Value
@Builder
@Jacksonized
public class PropertyRecord {

    String code;

    String name;

    /** Id of the property in the upstream PMS */
    String externalRef;

    @Builder.Default
    boolean active = true;

    /** e.g. state, stateCode, region, location, address */
    @Singular
    Map<String, String> attributes;
}
