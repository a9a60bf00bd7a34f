package com.gprintex.commission.repository;

import com.gprintex.commission.domain.CommissionConfig;
import com.gprintex.commission.domain.ConfigStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JdbcCommissionConfigRepository implements CommissionConfigRepository {

    private static final String SELECT = """
        SELECT id, name, status, base_commission_rate, pilot_bonus_rate, multi_year_bonus_rate,
               upfront_bonus_rate, annual_cap_amount, deceleration_rate, high_value_threshold,
               high_value_rate, version, supersedes_id, created_at, created_by
          FROM commission_configs
        """;

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbc;

    public JdbcCommissionConfigRepository(JdbcTemplate jdbcTemplate, NamedParameterJdbcTemplate namedJdbc) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbc = namedJdbc;
    }

    @Override
    public CommissionConfig insert(CommissionConfig config) {
        var params = new MapSqlParameterSource()
            .addValue("name", config.name())
            .addValue("status", config.status().wireValue())
            .addValue("baseRate", config.baseCommissionRate())
            .addValue("pilotRate", config.pilotBonusRate())
            .addValue("multiYearRate", config.multiYearBonusRate())
            .addValue("upfrontRate", config.upfrontBonusRate())
            .addValue("cap", config.annualCapAmount().orElse(null))
            .addValue("deceleration", config.decelerationRate())
            .addValue("hvThreshold", config.highValueThreshold().orElse(null))
            .addValue("hvRate", config.highValueRate().orElse(null))
            .addValue("version", config.version())
            .addValue("supersedesId", config.supersedesId().orElse(null))
            .addValue("createdBy", config.createdBy().orElse(null));
        var keyHolder = new GeneratedKeyHolder();
        namedJdbc.update("""
            INSERT INTO commission_configs (
                name, status, base_commission_rate, pilot_bonus_rate, multi_year_bonus_rate,
                upfront_bonus_rate, annual_cap_amount, deceleration_rate, high_value_threshold,
                high_value_rate, version, supersedes_id, created_by
            ) VALUES (
                :name, :status, :baseRate, :pilotRate, :multiYearRate,
                :upfrontRate, :cap, :deceleration, :hvThreshold,
                :hvRate, :version, :supersedesId, :createdBy
            )
            """, params, keyHolder, new String[]{"ID"});
        return config.withId(JdbcKeys.requireKey(keyHolder));
    }

    @Override
    public Optional<CommissionConfig> findById(Long id) {
        return jdbcTemplate.query(SELECT + " WHERE id = ?", rowMapper(), id)
            .stream()
            .findFirst();
    }

    @Override
    public List<CommissionConfig> findAll(Optional<ConfigStatus> status) {
        return status
            .map(s -> jdbcTemplate.query(SELECT + " WHERE status = ? ORDER BY name, version", rowMapper(), s.wireValue()))
            .orElseGet(() -> jdbcTemplate.query(SELECT + " ORDER BY name, version", rowMapper()));
    }

    @Override
    public boolean updateStatus(Long id, ConfigStatus status) {
        return jdbcTemplate.update(
            "UPDATE commission_configs SET status = ? WHERE id = ?", status.wireValue(), id) == 1;
    }

    private RowMapper<CommissionConfig> rowMapper() {
        return (rs, rowNum) -> new CommissionConfig(
            Optional.of(rs.getLong("ID")),
            rs.getString("NAME"),
            ConfigStatus.fromWire(rs.getString("STATUS")),
            rs.getBigDecimal("BASE_COMMISSION_RATE"),
            rs.getBigDecimal("PILOT_BONUS_RATE"),
            rs.getBigDecimal("MULTI_YEAR_BONUS_RATE"),
            rs.getBigDecimal("UPFRONT_BONUS_RATE"),
            Optional.ofNullable(rs.getBigDecimal("ANNUAL_CAP_AMOUNT")),
            rs.getBigDecimal("DECELERATION_RATE"),
            Optional.ofNullable(rs.getBigDecimal("HIGH_VALUE_THRESHOLD")),
            Optional.ofNullable(rs.getBigDecimal("HIGH_VALUE_RATE")),
            rs.getInt("VERSION"),
            Optional.ofNullable(rs.getObject("SUPERSEDES_ID", Long.class)),
            JdbcKeys.localDateTime(rs.getTimestamp("CREATED_AT")),
            Optional.ofNullable(rs.getString("CREATED_BY"))
        );
    }
}
