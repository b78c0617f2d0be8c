package com.bookingchart.defrag.repository;

import com.bookingchart.defrag.model.DefragMove;
import com.bookingchart.defrag.model.HolidayImportance;
import com.bookingchart.defrag.model.HolidayType;
import com.bookingchart.defrag.model.MovePayload;
import com.bookingchart.defrag.model.MoveStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static com.bookingchart.defrag.repository.JdbcSupport.localDateTime;
import static com.bookingchart.defrag.repository.JdbcSupport.ts;

/**
 * Move rows. Final transitions are compare-and-set updates on both terminal flags:
 * a zero row count means another caller finalized the move first.
 */
@Repository
@Slf4j
public class DefragMoveRepository {

    private static final String SELECT = """
            SELECT id, property_code, batch_id, analysis_date, created_at, move_data, status,
                   is_processed, is_rejected, suggested_by, suggested_at, approved_by, approved_at,
                   rejected_by, rejected_at, processed_by, processed_at,
                   is_holiday_move, holiday_period_name, holiday_type, holiday_importance
            FROM defrag_moves
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<DefragMove> rowMapper = this::mapRow;

    public DefragMoveRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public DefragMove insert(DefragMove move) {
        String payloadJson = writePayload(move.getPayload());
        KeyHolder keys = new GeneratedKeyHolder();

        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement("""
                    INSERT INTO defrag_moves
                    (property_code, batch_id, analysis_date, created_at, move_data, status,
                     is_processed, is_rejected, suggested_by, suggested_at,
                     is_holiday_move, holiday_period_name, holiday_type, holiday_importance)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """, new String[]{"id"});
            ps.setString(1, move.getPropertyCode());
            if (move.getBatchId() != null) {
                ps.setLong(2, move.getBatchId());
            } else {
                ps.setNull(2, Types.BIGINT);
            }
            ps.setTimestamp(3, ts(move.getAnalysisDate()));
            ps.setTimestamp(4, ts(move.getCreatedAt()));
            ps.setString(5, payloadJson);
            ps.setString(6, move.getStatus().value());
            ps.setBoolean(7, move.isProcessed());
            ps.setBoolean(8, move.isRejected());
            ps.setString(9, move.getSuggestedBy());
            ps.setTimestamp(10, ts(move.getSuggestedAt()));
            ps.setBoolean(11, move.isHolidayMove());
            ps.setString(12, move.getHolidayPeriodName());
            ps.setString(13, move.getHolidayType() != null ? move.getHolidayType().value() : null);
            ps.setString(14, move.getHolidayImportance() != null ? move.getHolidayImportance().name() : null);
            return ps;
        }, keys);

        Number id = keys.getKey();
        if (id == null) {
            throw new DataRetrievalFailureException("No id generated for move of " + move.getPropertyCode());
        }
        move.setId(id.longValue());
        return move;
    }

    public Optional<DefragMove> findById(long id) {
        return jdbcTemplate.query(SELECT + " WHERE id = ?", rowMapper, id)
                .stream()
                .findFirst();
    }

    public List<DefragMove> findByBatch(long batchId) {
        return jdbcTemplate.query(SELECT + " WHERE batch_id = ? ORDER BY id", rowMapper, batchId);
    }

    public int countByBatch(long batchId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM defrag_moves WHERE batch_id = ?", Integer.class, batchId);
        return count == null ? 0 : count;
    }

    /** Oldest first, for operational queues such as "pending moves". */
    public List<DefragMove> findByStatus(MoveStatus status, int limit) {
        return jdbcTemplate.query(SELECT + " WHERE status = ? ORDER BY created_at, id LIMIT ?",
                rowMapper, status.value(), limit);
    }

    public boolean approve(long id, String actor, LocalDateTime at) {
        return jdbcTemplate.update("""
                        UPDATE defrag_moves
                        SET status = 'approved', is_processed = TRUE,
                            approved_by = ?, approved_at = ?, processed_by = ?, processed_at = ?
                        WHERE id = ? AND is_processed = FALSE AND is_rejected = FALSE
                        """,
                actor, ts(at), actor, ts(at), id) > 0;
    }

    public boolean reject(long id, String actor, LocalDateTime at) {
        return jdbcTemplate.update("""
                        UPDATE defrag_moves
                        SET status = 'rejected', is_rejected = TRUE, rejected_by = ?, rejected_at = ?
                        WHERE id = ? AND is_processed = FALSE AND is_rejected = FALSE
                        """,
                actor, ts(at), id) > 0;
    }

    // ── Mapping ──────────────────────────────────────────────────────────────

    private DefragMove mapRow(ResultSet rs, int rowNum) throws SQLException {
        long rawBatchId = rs.getLong("batch_id");
        Long batchId = rs.wasNull() ? null : rawBatchId;
        String holidayType = rs.getString("holiday_type");
        String importance = rs.getString("holiday_importance");

        return DefragMove.builder()
                .id(rs.getLong("id"))
                .propertyCode(rs.getString("property_code"))
                .batchId(batchId)
                .analysisDate(localDateTime(rs, "analysis_date"))
                .createdAt(localDateTime(rs, "created_at"))
                .payload(readPayload(rs.getLong("id"), rs.getString("move_data")))
                .status(MoveStatus.fromValue(rs.getString("status")))
                .processed(rs.getBoolean("is_processed"))
                .rejected(rs.getBoolean("is_rejected"))
                .suggestedBy(rs.getString("suggested_by"))
                .suggestedAt(localDateTime(rs, "suggested_at"))
                .approvedBy(rs.getString("approved_by"))
                .approvedAt(localDateTime(rs, "approved_at"))
                .rejectedBy(rs.getString("rejected_by"))
                .rejectedAt(localDateTime(rs, "rejected_at"))
                .processedBy(rs.getString("processed_by"))
                .processedAt(localDateTime(rs, "processed_at"))
                .holidayMove(rs.getBoolean("is_holiday_move"))
                .holidayPeriodName(rs.getString("holiday_period_name"))
                .holidayType(holidayType != null ? HolidayType.fromValue(holidayType) : null)
                .holidayImportance(importance != null ? HolidayImportance.valueOf(importance) : null)
                .build();
    }

    private String writePayload(MovePayload payload) {
        try {
            return objectMapper.writeValueAsString(payload.document());
        } catch (JsonProcessingException e) {
            throw new InvalidDataAccessApiUsageException("Move payload could not be serialised", e);
        }
    }

    private MovePayload readPayload(long moveId, String json) {
        try {
            return MovePayload.of(objectMapper.readTree(json));
        } catch (JsonProcessingException | RuntimeException e) {
            throw new DataRetrievalFailureException("Stored payload of move " + moveId + " is unreadable", e);
        }
    }
}
