package com.gprintex.commission.repository;

import com.gprintex.commission.domain.CommissionAssignment;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcAssignmentRepository implements AssignmentRepository {

    private static final String SELECT = """
        SELECT id, ae_id, config_id, effective_date, end_date, created_at, created_by
          FROM ae_commission_assignments
        """;

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbc;

    public JdbcAssignmentRepository(JdbcTemplate jdbcTemplate, NamedParameterJdbcTemplate namedJdbc) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbc = namedJdbc;
    }

    @Override
    public CommissionAssignment insert(CommissionAssignment assignment) {
        var params = new MapSqlParameterSource()
            .addValue("aeId", assignment.aeId())
            .addValue("configId", assignment.configId())
            .addValue("effectiveDate", JdbcKeys.date(assignment.effectiveDate()))
            .addValue("endDate", JdbcKeys.date(assignment.endDate()))
            .addValue("createdBy", assignment.createdBy().orElse(null));
        var keyHolder = new GeneratedKeyHolder();
        namedJdbc.update("""
            INSERT INTO ae_commission_assignments (ae_id, config_id, effective_date, end_date, created_by)
            VALUES (:aeId, :configId, :effectiveDate, :endDate, :createdBy)
            """, params, keyHolder, new String[]{"ID"});
        return assignment.withId(JdbcKeys.requireKey(keyHolder));
    }

    @Override
    public Optional<CommissionAssignment> findById(Long id) {
        return jdbcTemplate.query(SELECT + " WHERE id = ?", rowMapper(), id)
            .stream()
            .findFirst();
    }

    @Override
    public List<CommissionAssignment> findCovering(Long aeId, LocalDate onDate) {
        var sql = SELECT + """
             WHERE ae_id = ?
               AND effective_date <= ?
               AND (end_date IS NULL OR end_date > ?)
             ORDER BY effective_date DESC, id DESC
            """;
        var date = JdbcKeys.date(onDate);
        return jdbcTemplate.query(sql, rowMapper(), aeId, date, date);
    }

    @Override
    public List<CommissionAssignment> findByAe(Long aeId) {
        return jdbcTemplate.query(SELECT + " WHERE ae_id = ? ORDER BY effective_date", rowMapper(), aeId);
    }

    @Override
    public List<CommissionAssignment> findActiveForConfig(Long configId, LocalDate fromDate) {
        return jdbcTemplate.query(
            SELECT + " WHERE config_id = ? AND (end_date IS NULL OR end_date > ?) ORDER BY ae_id",
            rowMapper(), configId, JdbcKeys.date(fromDate));
    }

    @Override
    public boolean setEndDate(Long assignmentId, LocalDate endDate) {
        return jdbcTemplate.update(
            "UPDATE ae_commission_assignments SET end_date = ? WHERE id = ?",
            JdbcKeys.date(endDate), assignmentId) == 1;
    }

    @Override
    public boolean updateConfig(Long assignmentId, Long configId) {
        return jdbcTemplate.update(
            "UPDATE ae_commission_assignments SET config_id = ? WHERE id = ?", configId, assignmentId) == 1;
    }

    private RowMapper<CommissionAssignment> rowMapper() {
        return (rs, rowNum) -> new CommissionAssignment(
            Optional.of(rs.getLong("ID")),
            rs.getLong("AE_ID"),
            rs.getLong("CONFIG_ID"),
            rs.getDate("EFFECTIVE_DATE").toLocalDate(),
            JdbcKeys.localDate(rs.getDate("END_DATE")),
            JdbcKeys.localDateTime(rs.getTimestamp("CREATED_AT")),
            Optional.ofNullable(rs.getString("CREATED_BY"))
        );
    }
}
