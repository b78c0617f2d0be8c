package com.bookingchart.defrag.service;

import com.bookingchart.defrag.config.DefragProperties;
import com.bookingchart.defrag.exception.NotFoundException;
import com.bookingchart.defrag.exception.StateConflictException;
import com.bookingchart.defrag.exception.ValidationException;
import com.bookingchart.defrag.model.BatchAssignment;
import com.bookingchart.defrag.model.BatchStatus;
import com.bookingchart.defrag.model.DefragMove;
import com.bookingchart.defrag.model.HolidayPeriod;
import com.bookingchart.defrag.model.MoveAction;
import com.bookingchart.defrag.model.MoveBatch;
import com.bookingchart.defrag.model.MovePayload;
import com.bookingchart.defrag.model.MoveStatus;
import com.bookingchart.defrag.model.Property;
import com.bookingchart.defrag.model.TransitionResult;
import com.bookingchart.defrag.repository.LedgerUnitOfWork;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Owns the batch and move lifecycle.
 *
 * Batch: pending → processing → completed, or pending → failed when its moves could not be stored.
 * Move:  pending → approved | rejected, both final.
 *
 * Every state change runs as a single unit of work. A move transition and the matching batch
 * counter increment commit together or not at all. Holiday lookups happen before the write
 * unit opens so that no connection is held while a calendar is being fetched.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MoveBatchLedger {

    private final LedgerUnitOfWork unitOfWork;
    private final HolidayPeriodEngine holidayEngine;
    private final DefragProperties properties;
    private final Clock clock;

    // ── Batch creation ───────────────────────────────────────────────────────

    public MoveBatch createBatch(String propertyCode, String creator) {
        String code = requirePropertyCode(propertyCode);
        LocalDateTime now = LocalDateTime.now(clock);

        MoveBatch batch = unitOfWork.execute("createBatch", ctx -> {
            Property property = ctx.properties().findByCode(code)
                    .orElseThrow(() -> NotFoundException.property(code));
            if (!property.isActive()) {
                throw new ValidationException("Property " + code + " is inactive");
            }
            return ctx.batches().insert(MoveBatch.builder()
                    .propertyCode(code)
                    .createdBy(creator)
                    .createdAt(now)
                    .status(BatchStatus.PENDING)
                    .build());
        });

        log.info("Created batch {} for {} by {}", batch.getId(), code, creator);
        return batch;
    }

    /**
     * Attach the analysis output to a pending, empty batch, tagging each move with the
     * holiday period it overlaps. All moves are validated before anything is written, and
     * the assignment is stored as one unit: readers never see a partially filled batch.
     */
    public List<DefragMove> assignMoves(long batchId, List<JsonNode> rawMoves) {
        return assign(batchId, toPayloads(rawMoves));
    }

    /**
     * createBatch followed by assignMoves. Input is validated before the batch exists; if the
     * moves cannot be assigned for any reason the batch is marked failed and the error is re-thrown.
     */
    public BatchAssignment createBatchWithMoves(String propertyCode, String creator, List<JsonNode> rawMoves) {
        List<MovePayload> payloads = toPayloads(rawMoves);
        MoveBatch batch = createBatch(propertyCode, creator);

        List<DefragMove> moves;
        try {
            moves = assign(batch.getId(), payloads);
        } catch (RuntimeException e) {
            markFailed(batch.getId(), e);
            throw e;
        }
        return new BatchAssignment(findBatch(batch.getId()), moves);
    }

    // ── Transitions ──────────────────────────────────────────────────────────

    /**
     * Approve or reject a move and count it against its batch, atomically.
     *
     * @throws NotFoundException      the move or its batch does not exist
     * @throws StateConflictException the move is already final, or a concurrent call finalized it first
     */
    public TransitionResult transitionMove(long moveId, MoveAction action, String actor) {
        if (action == null) {
            throw new ValidationException("action is required (approve|reject)");
        }
        if (actor == null || actor.isBlank()) {
            throw new ValidationException("actor is required");
        }
        String by = actor.trim();
        LocalDateTime now = LocalDateTime.now(clock);

        TransitionResult result = unitOfWork.execute("transitionMove", ctx -> {
            DefragMove move = ctx.moves().findById(moveId)
                    .orElseThrow(() -> NotFoundException.move(moveId));
            if (move.getBatchId() == null) {
                throw new NotFoundException("Move " + moveId + " is not assigned to a batch");
            }
            long batchId = move.getBatchId();
            ctx.batches().findById(batchId).orElseThrow(() -> NotFoundException.batch(batchId));

            if (move.isFinalized()) {
                throw new StateConflictException("Move " + moveId + " is already " + move.getStatus().value());
            }

            boolean moved = action == MoveAction.APPROVE
                    ? ctx.moves().approve(moveId, by, now)
                    : ctx.moves().reject(moveId, by, now);
            if (!moved) {
                throw new StateConflictException("Move " + moveId + " was finalized by a concurrent request");
            }
            if (!ctx.batches().recordResolution(batchId, action)) {
                throw new StateConflictException("Batch " + batchId + " has no unresolved moves left");
            }

            return new TransitionResult(
                    ctx.moves().findById(moveId).orElseThrow(() -> NotFoundException.move(moveId)),
                    ctx.batches().findById(batchId).orElseThrow(() -> NotFoundException.batch(batchId)));
        });

        MoveBatch batch = result.batch();
        log.info("Move {} {} by {} (batch {}: {} {}%)", moveId, result.move().getStatus().value(), by,
                batch.getId(), batch.getStatus().value(), batch.getCompletionPercentage());
        return result;
    }

    // ── Queries ──────────────────────────────────────────────────────────────

    public MoveBatch findBatch(long batchId) {
        return unitOfWork.read("findBatch", ctx -> ctx.batches().findById(batchId))
                .orElseThrow(() -> NotFoundException.batch(batchId));
    }

    public DefragMove findMove(long moveId) {
        return unitOfWork.read("findMove", ctx -> ctx.moves().findById(moveId))
                .orElseThrow(() -> NotFoundException.move(moveId));
    }

    public List<MoveBatch> batchesForProperty(String propertyCode, BatchStatus status) {
        String code = requirePropertyCode(propertyCode);
        return unitOfWork.read("batchesForProperty", ctx -> {
            ctx.properties().findByCode(code).orElseThrow(() -> NotFoundException.property(code));
            return ctx.batches().findByProperty(code, status);
        });
    }

    public List<DefragMove> movesInBatch(long batchId) {
        return unitOfWork.read("movesInBatch", ctx -> {
            ctx.batches().findById(batchId).orElseThrow(() -> NotFoundException.batch(batchId));
            return ctx.moves().findByBatch(batchId);
        });
    }

    public List<DefragMove> movesByStatus(MoveStatus status, Integer limit) {
        if (status == null) {
            throw new ValidationException("status is required");
        }
        int max = limit == null ? properties.getLedger().getDefaultQueryLimit() : limit;
        if (max <= 0) {
            throw new ValidationException("limit must be positive");
        }
        return unitOfWork.read("movesByStatus", ctx -> ctx.moves().findByStatus(status, max));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<DefragMove> assign(long batchId, List<MovePayload> payloads) {
        record Target(MoveBatch batch, Property property) {}

        Target target = unitOfWork.read("loadBatchForAssignment", ctx -> {
            MoveBatch batch = ctx.batches().findById(batchId)
                    .orElseThrow(() -> NotFoundException.batch(batchId));
            Property property = ctx.properties().findByCode(batch.getPropertyCode())
                    .orElseThrow(() -> NotFoundException.property(batch.getPropertyCode()));
            return new Target(batch, property);
        });
        MoveBatch batch = target.batch();
        requireAssignable(batch);

        List<HolidayPeriod> periods = forwardPeriods(target.property());
        LocalDateTime now = LocalDateTime.now(clock);

        List<DefragMove> moves = new ArrayList<>(payloads.size());
        for (MovePayload payload : payloads) {
            DefragMove move = DefragMove.builder()
                    .propertyCode(batch.getPropertyCode())
                    .batchId(batchId)
                    .analysisDate(batch.getCreatedAt())
                    .createdAt(now)
                    .payload(payload)
                    .status(MoveStatus.PENDING)
                    .suggestedBy(batch.getCreatedBy())
                    .suggestedAt(now)
                    .build();
            holidayEngine.selectTag(periods, payload.stayRange()).ifPresent(move::applyHolidayTag);
            moves.add(move);
        }

        List<DefragMove> stored = unitOfWork.execute("assignMoves", ctx -> {
            MoveBatch current = ctx.batches().findById(batchId)
                    .orElseThrow(() -> NotFoundException.batch(batchId));
            requireAssignable(current);
            if (ctx.moves().countByBatch(batchId) > 0 || !ctx.batches().assignTotal(batchId, moves.size())) {
                throw new StateConflictException("Batch " + batchId + " already has moves assigned");
            }
            moves.forEach(ctx.moves()::insert);
            return moves;
        });

        long tagged = stored.stream().filter(DefragMove::isHolidayMove).count();
        log.info("Assigned {} moves to batch {} ({} holiday moves)", stored.size(), batchId, tagged);
        return stored;
    }

    private List<HolidayPeriod> forwardPeriods(Property property) {
        if (property.getRegionCode() == null) {
            log.warn("Property {} has no region, skipping holiday tagging", property.getCode());
            return List.of();
        }
        return holidayEngine.combinedForwardPeriods(
                property.getRegionCode(),
                LocalDate.now(clock),
                properties.getHolidays().getForwardWindowDays());
    }

    private void requireAssignable(MoveBatch batch) {
        if (batch.getStatus() != BatchStatus.PENDING || batch.getTotalMoves() != 0) {
            throw new StateConflictException("Batch " + batch.getId() + " is " + batch.getStatus().value()
                    + " with " + batch.getTotalMoves() + " moves and cannot take new moves");
        }
    }

    private void markFailed(long batchId, RuntimeException cause) {
        try {
            boolean failed = unitOfWork.execute("markBatchFailed", ctx -> ctx.batches().markFailed(batchId));
            if (failed) {
                log.error("Batch {} marked failed: {}", batchId, cause.getMessage());
            } else {
                log.warn("Batch {} already has moves, left as is: {}", batchId, cause.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("Could not mark batch {} as failed: {}", batchId, e.getMessage(), e);
            cause.addSuppressed(e);
        }
    }

    private List<MovePayload> toPayloads(List<JsonNode> rawMoves) {
        if (rawMoves == null) {
            throw new ValidationException("moves are required");
        }
        List<MovePayload> payloads = new ArrayList<>(rawMoves.size());
        for (int i = 0; i < rawMoves.size(); i++) {
            try {
                payloads.add(MovePayload.of(rawMoves.get(i)));
            } catch (ValidationException e) {
                throw new ValidationException("Move " + (i + 1) + ": " + e.getMessage());
            }
        }
        return payloads;
    }

    private static String requirePropertyCode(String propertyCode) {
        if (propertyCode == null || propertyCode.isBlank()) {
            throw new ValidationException("propertyCode is required");
        }
        return propertyCode.trim().toUpperCase(Locale.ROOT);
    }
}
