package com.bookingchart.defrag.output;

import com.bookingchart.defrag.config.DefragProperties;
import com.bookingchart.defrag.model.BatchStatus;
import com.bookingchart.defrag.model.DefragMove;
import com.bookingchart.defrag.model.HolidayPeriod;
import com.bookingchart.defrag.model.HolidayType;
import com.bookingchart.defrag.model.MoveBatch;
import com.bookingchart.defrag.model.MovePayload;
import com.bookingchart.defrag.model.MoveStatus;
import com.bookingchart.defrag.model.RegionCode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BatchCsvWriter")
class BatchCsvWriterTest {

    @TempDir
    Path tempDir;

    private DefragProperties properties;
    private BatchCsvWriter writer;
    private DefragMove tagged;
    private DefragMove plain;

    @BeforeEach
    void setUp() throws Exception {
        properties = new DefragProperties();
        properties.getExport().setOutputDir(tempDir.resolve("out").toString());
        writer = new BatchCsvWriter(properties);

        ObjectMapper mapper = new ObjectMapper();
        tagged = DefragMove.builder()
                .id(11L)
                .batchId(7L)
                .propertyCode("VMEL")
                .status(MoveStatus.APPROVED)
                .payload(MovePayload.of(mapper.readTree(
                        "{\"check_in\": \"2025-04-17\", \"check_out\": \"2025-04-20\", \"guest\": \"Lee, J\"}")))
                .suggestedBy("analysis")
                .suggestedAt(LocalDateTime.of(2025, 3, 1, 9, 0))
                .approvedBy("jo")
                .approvedAt(LocalDateTime.of(2025, 3, 1, 10, 30))
                .build();
        tagged.applyHolidayTag(HolidayPeriod.of("Good Friday", HolidayType.PUBLIC,
                LocalDate.of(2025, 4, 18), LocalDate.of(2025, 4, 18), RegionCode.VIC));

        plain = DefragMove.builder()
                .id(12L)
                .batchId(7L)
                .propertyCode("VMEL")
                .status(MoveStatus.PENDING)
                .payload(MovePayload.of(mapper.readTree(
                        "{\"check_in\": \"2025-05-10\", \"check_out\": \"2025-05-12\"}")))
                .build();
    }

    private List<String[]> readBack(String csv) throws Exception {
        try (CSVReader reader = new CSVReader(new StringReader(csv))) {
            return reader.readAll();
        }
    }

    @Test
    @DisplayName("writes a header and one row per move")
    void headerAndRows() throws Exception {
        StringWriter out = new StringWriter();

        writer.write(out, List.of(tagged, plain));

        List<String[]> rows = readBack(out.toString());
        assertThat(rows).hasSize(3);
        assertThat(rows.get(0)).containsExactly(BatchCsvWriter.HEADERS);
        assertThat(rows.get(1)).containsExactly(
                "11", "7", "VMEL", "approved", "2025-04-17", "2025-04-20",
                "analysis", "2025-03-01T09:00", "jo", "2025-03-01T10:30", "", "",
                "true", "Good Friday", "public", "HIGH",
                "{\"check_in\":\"2025-04-17\",\"check_out\":\"2025-04-20\",\"guest\":\"Lee, J\"}");
        assertThat(rows.get(2)[3]).isEqualTo("pending");
        assertThat(rows.get(2)[12]).isEqualTo("false");
        assertThat(rows.get(2)[13]).isEmpty();
    }

    @Test
    @DisplayName("header can be switched off")
    void noHeader() throws Exception {
        properties.getExport().setIncludeHeader(false);
        StringWriter out = new StringWriter();

        writer.write(out, List.of(plain));

        assertThat(readBack(out.toString())).hasSize(1);
    }

    @Test
    @DisplayName("export creates the output directory and names the file after property and batch")
    void exportToFile() throws Exception {
        MoveBatch batch = MoveBatch.builder()
                .id(7L)
                .propertyCode("VMEL")
                .status(BatchStatus.PROCESSING)
                .totalMoves(2)
                .build();

        Path path = writer.export(batch, List.of(tagged, plain));

        assertThat(path).isEqualTo(tempDir.resolve("out").resolve("moves_VMEL_7.csv"));
        assertThat(Files.readAllLines(path)).hasSize(3);
    }
}
