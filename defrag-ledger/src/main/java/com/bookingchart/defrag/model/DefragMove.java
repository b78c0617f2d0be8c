package com.bookingchart.defrag.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * One suggested relocation of a booking, owned by exactly one batch.
 *
 * processed and rejected are mutually exclusive terminal flags. Once either is
 * set the move is final and the ledger refuses any further transition.
 */
@Data
@Builder
public class DefragMove {

    private Long id;
    private String propertyCode;
    private Long batchId;

    /** When the analysis run that produced this move completed */
    private LocalDateTime analysisDate;
    private LocalDateTime createdAt;

    private MovePayload payload;

    private MoveStatus status;
    private boolean processed;
    private boolean rejected;

    // ── Actors ──────────────────────────────────────────────────────────────
    private String suggestedBy;
    private LocalDateTime suggestedAt;
    private String approvedBy;
    private LocalDateTime approvedAt;
    private String rejectedBy;
    private LocalDateTime rejectedAt;
    private String processedBy;
    private LocalDateTime processedAt;

    // ── Holiday tag ─────────────────────────────────────────────────────────
    private boolean holidayMove;
    private String holidayPeriodName;
    private HolidayType holidayType;
    private HolidayImportance holidayImportance;

    public boolean isFinalized() {
        return processed || rejected;
    }

    public void applyHolidayTag(HolidayPeriod period) {
        this.holidayMove = true;
        this.holidayPeriodName = period.name();
        this.holidayType = period.type();
        this.holidayImportance = period.importance();
    }
}
