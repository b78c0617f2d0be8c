package com.bookingchart.defrag.output;

import com.bookingchart.defrag.config.DefragProperties;
import com.bookingchart.defrag.model.DefragMove;
import com.bookingchart.defrag.model.MoveBatch;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Writes the moves of a batch, with their review state and holiday tags, to CSV.
 *
 * Output path pattern: {outputDir}/moves_{propertyCode}_{batchId}.csv
 * e.g. /data/output/moves_CALI_42.csv
 *
 * The analysis document is written as-is in the last column (JSON).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BatchCsvWriter {

    private final DefragProperties properties;

    static final String[] HEADERS = {
            "move_id", "batch_id", "property_code",
            "status", "check_in", "check_out",
            "suggested_by", "suggested_at",
            "approved_by", "approved_at",
            "rejected_by", "rejected_at",
            "is_holiday_move", "holiday_period_name", "holiday_type", "holiday_importance",
            "move_data"
    };

    public Path export(MoveBatch batch, List<DefragMove> moves) {
        Path outputDir = Paths.get(properties.getExport().getOutputDir());
        ensureDirectory(outputDir);

        String filename = String.format("moves_%s_%d.csv", batch.getPropertyCode(), batch.getId());
        Path outputPath = outputDir.resolve(filename);

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            write(out, moves);
        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new RuntimeException("CSV export failed for batch " + batch.getId(), e);
        }

        log.info("Written {} moves of batch {} to CSV: {}", moves.size(), batch.getId(), outputPath);
        return outputPath;
    }

    /** Writes header (if enabled) and rows to {@code out}; the caller owns the writer. */
    public void write(Writer out, List<DefragMove> moves) throws IOException {
        CSVWriter writer = new CSVWriter(
                out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END);

        if (properties.getExport().isIncludeHeader()) {
            writer.writeNext(HEADERS);
        }
        for (DefragMove move : moves) {
            writer.writeNext(toRow(move));
        }
        writer.flush();
    }

    private String[] toRow(DefragMove m) {
        return new String[]{
                str(m.getId()),
                str(m.getBatchId()),
                str(m.getPropertyCode()),
                m.getStatus() == null ? "" : m.getStatus().value(),
                m.getPayload() == null ? "" : str(m.getPayload().stayRange().checkIn()),
                m.getPayload() == null ? "" : str(m.getPayload().stayRange().checkOut()),
                str(m.getSuggestedBy()),
                str(m.getSuggestedAt()),
                str(m.getApprovedBy()),
                str(m.getApprovedAt()),
                str(m.getRejectedBy()),
                str(m.getRejectedAt()),
                String.valueOf(m.isHolidayMove()),
                str(m.getHolidayPeriodName()),
                m.getHolidayType() == null ? "" : m.getHolidayType().value(),
                m.getHolidayImportance() == null ? "" : m.getHolidayImportance().name(),
                m.getPayload() == null ? "" : m.getPayload().document().toString()
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Cannot create output directory: " + dir, e);
        }
    }
}
