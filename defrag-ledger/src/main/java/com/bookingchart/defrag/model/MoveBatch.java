package com.bookingchart.defrag.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * A set of moves generated together from one analysis run for one property.
 *
 * Counters are only ever changed by the ledger, through single-statement
 * increments in the store. processedMoves + rejectedMoves never exceeds totalMoves.
 */
@Data
@Builder
public class MoveBatch {

    private Long id;
    private String propertyCode;
    private String createdBy;
    private LocalDateTime createdAt;
    private BatchStatus status;
    private int totalMoves;
    private int processedMoves;
    private int rejectedMoves;

    public int getResolvedMoves() {
        return processedMoves + rejectedMoves;
    }

    /** Share of resolved moves, rounded to one decimal place; 0 for an empty batch. */
    public double getCompletionPercentage() {
        if (totalMoves == 0) return 0.0;
        return BigDecimal.valueOf(getResolvedMoves() * 100.0 / totalMoves)
                .setScale(1, RoundingMode.HALF_UP)
                .doubleValue();
    }

    public boolean isComplete() {
        return getResolvedMoves() >= totalMoves;
    }
}
