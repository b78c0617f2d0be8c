package com.bookingchart.defrag.repository;

import com.bookingchart.defrag.model.BatchStatus;
import com.bookingchart.defrag.model.MoveAction;
import com.bookingchart.defrag.model.MoveBatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.util.List;
import java.util.Optional;

import static com.bookingchart.defrag.repository.JdbcSupport.localDateTime;
import static com.bookingchart.defrag.repository.JdbcSupport.ts;

/**
 * Batch rows. Counters are only moved by {@link #recordResolution}, a single
 * read-modify-write statement, so concurrent resolutions never lose an increment.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class MoveBatchRepository {

    private static final String SELECT = """
            SELECT id, property_code, created_by, created_at, status, total_moves, processed_moves, rejected_moves
            FROM move_batches
            """;

    /*
     * The CASE sees the pre-update counters, hence the "+ 1".
     * The guard keeps processed + rejected <= total even if a caller slips past the move check.
     */
    private static final String RECORD_APPROVAL = """
            UPDATE move_batches
            SET processed_moves = processed_moves + 1,
                status = CASE WHEN processed_moves + rejected_moves + 1 >= total_moves
                              THEN 'completed' ELSE 'processing' END
            WHERE id = ? AND processed_moves + rejected_moves < total_moves
            """;

    private static final String RECORD_REJECTION = """
            UPDATE move_batches
            SET rejected_moves = rejected_moves + 1,
                status = CASE WHEN processed_moves + rejected_moves + 1 >= total_moves
                              THEN 'completed' ELSE 'processing' END
            WHERE id = ? AND processed_moves + rejected_moves < total_moves
            """;

    private static final RowMapper<MoveBatch> ROW_MAPPER = (rs, i) -> MoveBatch.builder()
            .id(rs.getLong("id"))
            .propertyCode(rs.getString("property_code"))
            .createdBy(rs.getString("created_by"))
            .createdAt(localDateTime(rs, "created_at"))
            .status(BatchStatus.fromValue(rs.getString("status")))
            .totalMoves(rs.getInt("total_moves"))
            .processedMoves(rs.getInt("processed_moves"))
            .rejectedMoves(rs.getInt("rejected_moves"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public MoveBatch insert(MoveBatch batch) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement("""
                    INSERT INTO move_batches
                    (property_code, created_by, created_at, status, total_moves, processed_moves, rejected_moves)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                    """, new String[]{"id"});
            ps.setString(1, batch.getPropertyCode());
            ps.setString(2, batch.getCreatedBy());
            ps.setTimestamp(3, ts(batch.getCreatedAt()));
            ps.setString(4, batch.getStatus().value());
            ps.setInt(5, batch.getTotalMoves());
            ps.setInt(6, batch.getProcessedMoves());
            ps.setInt(7, batch.getRejectedMoves());
            return ps;
        }, keys);

        Number id = keys.getKey();
        if (id == null) {
            throw new DataRetrievalFailureException("No id generated for batch of " + batch.getPropertyCode());
        }
        batch.setId(id.longValue());
        return batch;
    }

    public Optional<MoveBatch> findById(long id) {
        return jdbcTemplate.query(SELECT + " WHERE id = ?", ROW_MAPPER, id)
                .stream()
                .findFirst();
    }

    public List<MoveBatch> findByProperty(String propertyCode, BatchStatus status) {
        if (status == null) {
            return jdbcTemplate.query(SELECT + " WHERE property_code = ? ORDER BY created_at DESC, id DESC",
                    ROW_MAPPER, propertyCode);
        }
        return jdbcTemplate.query(SELECT + " WHERE property_code = ? AND status = ? ORDER BY created_at DESC, id DESC",
                ROW_MAPPER, propertyCode, status.value());
    }

    /**
     * Fix the move count of a pending, still empty batch. An empty assignment
     * completes the batch immediately. Returns false when the batch is not pending.
     */
    public boolean assignTotal(long id, int totalMoves) {
        BatchStatus next = totalMoves == 0 ? BatchStatus.COMPLETED : BatchStatus.PENDING;
        return jdbcTemplate.update("""
                        UPDATE move_batches SET total_moves = ?, status = ?
                        WHERE id = ? AND status = 'pending' AND total_moves = 0
                        """,
                totalMoves, next.value(), id) > 0;
    }

    /**
     * Count one resolved move against the batch and recompute its status.
     * Returns false when the batch is already fully resolved (or missing).
     */
    public boolean recordResolution(long id, MoveAction action) {
        String sql = action == MoveAction.APPROVE ? RECORD_APPROVAL : RECORD_REJECTION;
        return jdbcTemplate.update(sql, id) > 0;
    }

    /** Only a batch that never got its moves can fail. */
    public boolean markFailed(long id) {
        return jdbcTemplate.update(
                "UPDATE move_batches SET status = 'failed' WHERE id = ? AND status = 'pending' AND total_moves = 0",
                id) > 0;
    }
}
