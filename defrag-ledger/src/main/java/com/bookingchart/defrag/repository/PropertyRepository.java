package com.bookingchart.defrag.repository;

import com.bookingchart.defrag.model.Property;
import com.bookingchart.defrag.model.RegionCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static com.bookingchart.defrag.repository.JdbcSupport.localDateTime;
import static com.bookingchart.defrag.repository.JdbcSupport.ts;

@Repository
@Slf4j
@RequiredArgsConstructor
public class PropertyRepository {

    private static final String SELECT = """
            SELECT property_code, property_name, external_ref, state_code, is_active, created_at, updated_at
            FROM properties
            """;

    private static final RowMapper<Property> ROW_MAPPER = (rs, i) -> Property.builder()
            .code(rs.getString("property_code"))
            .name(rs.getString("property_name"))
            .externalRef(rs.getString("external_ref"))
            .regionCode(RegionCode.fromCode(rs.getString("state_code")).orElse(null))
            .active(rs.getBoolean("is_active"))
            .createdAt(localDateTime(rs, "created_at"))
            .updatedAt(localDateTime(rs, "updated_at"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public Optional<Property> findByCode(String code) {
        return jdbcTemplate.query(SELECT + " WHERE property_code = ?", ROW_MAPPER, code)
                .stream()
                .findFirst();
    }

    public List<Property> findAll(boolean activeOnly) {
        String sql = activeOnly
                ? SELECT + " WHERE is_active = TRUE ORDER BY property_code"
                : SELECT + " ORDER BY property_code";
        return jdbcTemplate.query(sql, ROW_MAPPER);
    }

    /** Regions with at least one active property. */
    public List<RegionCode> findActiveRegions() {
        return jdbcTemplate.queryForList("""
                        SELECT DISTINCT state_code FROM properties
                        WHERE is_active = TRUE AND state_code IS NOT NULL
                        ORDER BY state_code
                        """, String.class)
                .stream()
                .map(RegionCode::fromCode)
                .flatMap(Optional::stream)
                .toList();
    }

    /**
     * Insert a new property or refresh name, external reference, region and active flag of
     * an existing one. Returns true when a new row was created.
     */
    public boolean upsert(Property property, LocalDateTime now) {
        String region = property.getRegionCode() != null ? property.getRegionCode().name() : null;

        int updated = jdbcTemplate.update("""
                        UPDATE properties
                        SET property_name = ?, external_ref = ?, state_code = ?, is_active = ?, updated_at = ?
                        WHERE property_code = ?
                        """,
                property.getName(), property.getExternalRef(), region, property.isActive(), ts(now),
                property.getCode());
        if (updated > 0) {
            return false;
        }

        jdbcTemplate.update("""
                        INSERT INTO properties
                        (property_code, property_name, external_ref, state_code, is_active, created_at, updated_at)
                        VALUES (?, ?, ?, ?, ?, ?, ?)
                        """,
                property.getCode(), property.getName(), property.getExternalRef(), region, property.isActive(),
                ts(now), ts(now));
        return true;
    }

    public boolean setActive(String code, boolean active, LocalDateTime now) {
        return jdbcTemplate.update(
                "UPDATE properties SET is_active = ?, updated_at = ? WHERE property_code = ?",
                active, ts(now), code) > 0;
    }
}
