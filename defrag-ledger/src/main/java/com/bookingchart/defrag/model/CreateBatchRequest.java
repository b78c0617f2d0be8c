package com.bookingchart.defrag.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Body of POST /batches. Moves are the raw analysis documents; each is validated
 * into a {@link MovePayload} before the batch is created.
 */
public record CreateBatchRequest(String propertyCode, String createdBy, List<JsonNode> moves) {
}
