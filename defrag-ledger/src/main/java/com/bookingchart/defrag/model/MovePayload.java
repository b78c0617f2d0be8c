package com.bookingchart.defrag.model;

import com.bookingchart.defrag.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.EqualsAndHashCode;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Move suggestion document as produced by the defragmentation analysis.
 *
 * The content (units, guest, score, reason, ...) belongs to the analysis and the
 * presentation layer. The ledger only ever reads the stay range out of it:
 * {@code check_in} and {@code check_out} as ISO dates.
 */
@EqualsAndHashCode
public final class MovePayload {

    public static final String CHECK_IN = "check_in";
    public static final String CHECK_OUT = "check_out";

    private final ObjectNode document;
    private final StayRange stayRange;

    private MovePayload(ObjectNode document, StayRange stayRange) {
        this.document = document;
        this.stayRange = stayRange;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static MovePayload of(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ValidationException("Move payload must be a JSON object");
        }
        ObjectNode document = ((ObjectNode) node).deepCopy();
        LocalDate checkIn = requireDate(document, CHECK_IN);
        LocalDate checkOut = requireDate(document, CHECK_OUT);
        if (checkOut.isBefore(checkIn)) {
            throw new ValidationException("Move payload check_out " + checkOut + " is before check_in " + checkIn);
        }
        return new MovePayload(document, new StayRange(checkIn, checkOut));
    }

    public StayRange stayRange() {
        return stayRange;
    }

    @JsonValue
    public ObjectNode document() {
        return document.deepCopy();
    }

    private static LocalDate requireDate(ObjectNode document, String field) {
        JsonNode value = document.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new ValidationException("Move payload is missing " + field);
        }
        try {
            return LocalDate.parse(value.asText().trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("Move payload " + field + " is not an ISO date: " + value.asText());
        }
    }

    @Override
    public String toString() {
        return "MovePayload" + document;
    }
}
