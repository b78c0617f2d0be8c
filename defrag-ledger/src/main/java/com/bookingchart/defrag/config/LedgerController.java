package com.bookingchart.defrag.config;

import com.bookingchart.defrag.exception.ValidationException;
import com.bookingchart.defrag.model.BatchAssignment;
import com.bookingchart.defrag.model.BatchStatus;
import com.bookingchart.defrag.model.CreateBatchRequest;
import com.bookingchart.defrag.model.DefragMove;
import com.bookingchart.defrag.model.HolidayPeriod;
import com.bookingchart.defrag.model.IngestSummary;
import com.bookingchart.defrag.model.MoveBatch;
import com.bookingchart.defrag.model.MoveStatus;
import com.bookingchart.defrag.model.Property;
import com.bookingchart.defrag.model.PropertyRecord;
import com.bookingchart.defrag.model.RegionCode;
import com.bookingchart.defrag.model.TransitionRequest;
import com.bookingchart.defrag.model.TransitionResult;
import com.bookingchart.defrag.output.BatchCsvWriter;
import com.bookingchart.defrag.service.HolidayPeriodEngine;
import com.bookingchart.defrag.service.MoveBatchLedger;
import com.bookingchart.defrag.service.PropertyRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

@RestController
@Slf4j
@RequiredArgsConstructor
public class LedgerController {

    private final MoveBatchLedger ledger;
    private final PropertyRegistry propertyRegistry;
    private final HolidayPeriodEngine holidayEngine;
    private final BatchCsvWriter csvWriter;
    private final DefragProperties properties;
    private final Clock clock;

    // ── Batches ───────────────────────────────────────────────────────────────

    /**
     * Record the output of one analysis run.
     *
     * POST /batches  {"propertyCode": "CALI", "createdBy": "analysis", "moves": [{...}]}
     */
    @PostMapping("/batches")
    public ResponseEntity<BatchAssignment> createBatch(@RequestBody CreateBatchRequest request) {
        BatchAssignment assignment = ledger.createBatchWithMoves(
                request.propertyCode(), request.createdBy(), request.moves());
        return ResponseEntity.status(HttpStatus.CREATED).body(assignment);
    }

    @GetMapping("/batches/{batchId}")
    public ResponseEntity<MoveBatch> getBatch(@PathVariable long batchId) {
        return ResponseEntity.ok(ledger.findBatch(batchId));
    }

    @GetMapping("/batches/{batchId}/moves")
    public ResponseEntity<List<DefragMove>> getBatchMoves(@PathVariable long batchId) {
        return ResponseEntity.ok(ledger.movesInBatch(batchId));
    }

    /**
     * Write the moves of a batch to {outputDir}/moves_{property}_{batchId}.csv.
     */
    @PostMapping("/batches/{batchId}/export")
    public ResponseEntity<Map<String, Object>> exportBatch(@PathVariable long batchId) {
        MoveBatch batch = ledger.findBatch(batchId);
        List<DefragMove> moves = ledger.movesInBatch(batchId);
        Path path = csvWriter.export(batch, moves);
        return ResponseEntity.ok(Map.of("batchId", batchId, "rows", moves.size(), "path", path.toString()));
    }

    @GetMapping("/properties/{propertyCode}/batches")
    public ResponseEntity<List<MoveBatch>> getPropertyBatches(
            @PathVariable String propertyCode,
            @RequestParam(required = false) String status) {
        BatchStatus filter = status == null ? null : parse(status, BatchStatus::fromValue, "batch status");
        return ResponseEntity.ok(ledger.batchesForProperty(propertyCode, filter));
    }

    // ── Moves ─────────────────────────────────────────────────────────────────

    /**
     * Approve or reject a single move.
     *
     * POST /moves/17/transition  {"action": "approve", "actor": "jo"}
     *
     * Returns the updated move and the batch aggregate. 409 if the move is already final.
     */
    @PostMapping("/moves/{moveId}/transition")
    public ResponseEntity<TransitionResult> transition(
            @PathVariable long moveId,
            @RequestBody TransitionRequest request) {
        return ResponseEntity.ok(ledger.transitionMove(moveId, request.action(), request.actor()));
    }

    @GetMapping("/moves/{moveId}")
    public ResponseEntity<DefragMove> getMove(@PathVariable long moveId) {
        return ResponseEntity.ok(ledger.findMove(moveId));
    }

    @GetMapping("/moves")
    public ResponseEntity<List<DefragMove>> getMovesByStatus(
            @RequestParam(defaultValue = "pending") String status,
            @RequestParam(required = false) Integer limit) {
        MoveStatus filter = parse(status, MoveStatus::fromValue, "move status");
        return ResponseEntity.ok(ledger.movesByStatus(filter, limit));
    }

    // ── Holidays ──────────────────────────────────────────────────────────────

    /**
     * Upcoming public and school holiday periods for a region.
     *
     * GET /holidays/VIC?from=2025-03-01&windowDays=60
     */
    @GetMapping("/holidays/{region}")
    public ResponseEntity<List<HolidayPeriod>> getHolidays(
            @PathVariable String region,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) Integer windowDays) {
        RegionCode code = RegionCode.fromCode(region)
                .orElseThrow(() -> new ValidationException("Unknown region: " + region));
        LocalDate start = from != null ? from : LocalDate.now(clock);
        int window = windowDays != null ? windowDays : properties.getHolidays().getForwardWindowDays();
        int maxWindow = properties.getHolidays().getMaxWindowDays();
        if (window <= 0 || window > maxWindow) {
            throw new ValidationException("windowDays must be between 1 and " + maxWindow);
        }
        return ResponseEntity.ok(holidayEngine.combinedForwardPeriods(code, start, window));
    }

    @GetMapping("/holidays/cache")
    public ResponseEntity<Map<String, Object>> holidayCacheStats() {
        return ResponseEntity.ok(holidayEngine.cacheStats());
    }

    // ── Properties ────────────────────────────────────────────────────────────

    @PostMapping("/properties/ingest")
    public ResponseEntity<IngestSummary> ingestProperties(@RequestBody List<PropertyRecord> records) {
        return ResponseEntity.ok(propertyRegistry.ingest(records));
    }

    @GetMapping("/properties")
    public ResponseEntity<List<Property>> getProperties(@RequestParam(defaultValue = "false") boolean activeOnly) {
        return ResponseEntity.ok(propertyRegistry.list(activeOnly));
    }

    @PostMapping("/properties/{propertyCode}/deactivate")
    public ResponseEntity<Property> deactivateProperty(@PathVariable String propertyCode) {
        return ResponseEntity.ok(propertyRegistry.deactivate(propertyCode));
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "booking-chart-defrag-ledger");
        body.put("version", "1.0.0");
        body.put("holidayCache", holidayEngine.cacheStats());
        return ResponseEntity.ok(body);
    }

    private static <T> T parse(String raw, Function<String, T> parser, String what) {
        try {
            return parser.apply(raw);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid " + what + ": " + raw);
        }
    }
}
