package com.gprintex.commission.repository;

import com.gprintex.commission.domain.Commission;
import com.gprintex.commission.domain.CommissionDetails;
import com.gprintex.commission.domain.CommissionStatus;
import com.gprintex.commission.domain.Money;
import com.gprintex.commission.domain.RevenueType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Repository
public class JdbcCommissionRepository implements CommissionRepository {

    private static final String COLUMNS = """
        c.id, c.invoice_id, c.ae_id, c.config_id, c.gross_base_commission, c.base_commission,
        c.pilot_bonus, c.multi_year_bonus, c.upfront_bonus, c.total_commission, c.ote_applied,
        c.status, c.approved_by, c.approved_at, c.rejection_reason, c.paid_by, c.paid_at,
        c.created_at, c.updated_at
        """;

    private static final String SELECT = "SELECT " + COLUMNS + " FROM commissions c";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbc;

    public JdbcCommissionRepository(JdbcTemplate jdbcTemplate, NamedParameterJdbcTemplate namedJdbc) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbc = namedJdbc;
    }

    @Override
    public Commission insert(Commission commission) {
        var params = figureParams(commission)
            .addValue("invoiceId", commission.invoiceId())
            .addValue("aeId", commission.aeId())
            .addValue("status", commission.status().wireValue())
            .addValue("createdAt", Timestamp.valueOf(commission.createdAt().orElseGet(LocalDateTime::now)));
        var keyHolder = new GeneratedKeyHolder();
        namedJdbc.update("""
            INSERT INTO commissions (
                invoice_id, ae_id, config_id, gross_base_commission, base_commission, pilot_bonus,
                multi_year_bonus, upfront_bonus, total_commission, ote_applied, status, created_at
            ) VALUES (
                :invoiceId, :aeId, :configId, :grossBase, :base, :pilot,
                :multiYear, :upfront, :total, :oteApplied, :status, :createdAt
            )
            """, params, keyHolder, new String[]{"ID"});
        return commission.withId(JdbcKeys.requireKey(keyHolder));
    }

    @Override
    public boolean updateStatus(Commission commission, CommissionStatus expected) {
        var params = new MapSqlParameterSource()
            .addValue("id", requireId(commission))
            .addValue("status", commission.status().wireValue())
            .addValue("expected", expected.wireValue())
            .addValue("approvedBy", commission.approvedBy().orElse(null))
            .addValue("approvedAt", JdbcKeys.timestamp(commission.approvedAt()))
            .addValue("rejectionReason", commission.rejectionReason().orElse(null))
            .addValue("paidBy", commission.paidBy().orElse(null))
            .addValue("paidAt", JdbcKeys.timestamp(commission.paidAt()))
            .addValue("updatedAt", Timestamp.valueOf(commission.updatedAt().orElseGet(LocalDateTime::now)));
        return namedJdbc.update("""
            UPDATE commissions
               SET status = :status, approved_by = :approvedBy, approved_at = :approvedAt,
                   rejection_reason = :rejectionReason, paid_by = :paidBy, paid_at = :paidAt,
                   updated_at = :updatedAt
             WHERE id = :id AND status = :expected
            """, params) == 1;
    }

    @Override
    public boolean updateFigures(Commission commission) {
        var params = figureParams(commission)
            .addValue("id", requireId(commission))
            .addValue("pending", CommissionStatus.PENDING.wireValue())
            .addValue("updatedAt", Timestamp.valueOf(commission.updatedAt().orElseGet(LocalDateTime::now)));
        return namedJdbc.update("""
            UPDATE commissions
               SET config_id = :configId, gross_base_commission = :grossBase, base_commission = :base,
                   pilot_bonus = :pilot, multi_year_bonus = :multiYear, upfront_bonus = :upfront,
                   total_commission = :total, ote_applied = :oteApplied, updated_at = :updatedAt
             WHERE id = :id AND status = :pending
            """, params) == 1;
    }

    @Override
    public Optional<Commission> findById(Long id) {
        return jdbcTemplate.query(SELECT + " WHERE c.id = ?", rowMapper(), id)
            .stream()
            .findFirst();
    }

    @Override
    public Optional<Commission> findByInvoiceId(Long invoiceId) {
        return jdbcTemplate.query(SELECT + " WHERE c.invoice_id = ?", rowMapper(), invoiceId)
            .stream()
            .findFirst();
    }

    @Override
    public List<CommissionDetails> findByFilter(CommissionFilter filter) {
        var sql = new StringBuilder("SELECT ").append(COLUMNS).append("""
            , k.client_name, a.name AS ae_name, i.invoice_date, i.amount AS invoice_amount, i.revenue_type
              FROM commissions c
              JOIN invoices i ON i.id = c.invoice_id
              JOIN contracts k ON k.id = i.contract_id
              JOIN account_executives a ON a.id = c.ae_id
             WHERE 1 = 1
            """);
        var params = new MapSqlParameterSource();
        filter.aeId().ifPresent(id -> {
            sql.append(" AND c.ae_id = :aeId");
            params.addValue("aeId", id);
        });
        filter.status().ifPresent(s -> {
            sql.append(" AND c.status = :status");
            params.addValue("status", s.wireValue());
        });
        filter.fromDate().ifPresent(d -> {
            sql.append(" AND i.invoice_date >= :fromDate");
            params.addValue("fromDate", JdbcKeys.date(d));
        });
        filter.toDate().ifPresent(d -> {
            sql.append(" AND i.invoice_date <= :toDate");
            params.addValue("toDate", JdbcKeys.date(d));
        });
        sql.append(" ORDER BY i.invoice_date, c.id");

        RowMapper<Commission> commissionMapper = rowMapper();
        return namedJdbc.query(sql.toString(), params, (rs, rowNum) -> new CommissionDetails(
            commissionMapper.mapRow(rs, rowNum),
            rs.getString("CLIENT_NAME"),
            rs.getString("AE_NAME"),
            rs.getDate("INVOICE_DATE").toLocalDate(),
            rs.getBigDecimal("INVOICE_AMOUNT"),
            RevenueType.fromWire(rs.getString("REVENUE_TYPE"))
        ));
    }

    @Override
    public BigDecimal sumBaseCommission(Long aeId, int year, Set<CommissionStatus> statuses) {
        if (statuses.isEmpty()) {
            return Money.ZERO;
        }
        var params = new MapSqlParameterSource()
            .addValue("aeId", aeId)
            .addValue("yearStart", JdbcKeys.date(LocalDate.of(year, 1, 1)))
            .addValue("nextYearStart", JdbcKeys.date(LocalDate.of(year + 1, 1, 1)))
            .addValue("statuses", statuses.stream().map(CommissionStatus::wireValue).toList());
        var sum = namedJdbc.queryForObject("""
            SELECT COALESCE(SUM(c.base_commission), 0)
              FROM commissions c
              JOIN invoices i ON i.id = c.invoice_id
             WHERE c.ae_id = :aeId
               AND i.invoice_date >= :yearStart
               AND i.invoice_date < :nextYearStart
               AND c.status IN (:statuses)
            """, params, BigDecimal.class);
        return Money.round(sum);
    }

    @Override
    public boolean existsLockedForContract(Long contractId) {
        var count = jdbcTemplate.queryForObject("""
            SELECT COUNT(*)
              FROM commissions c
              JOIN invoices i ON i.id = c.invoice_id
             WHERE i.contract_id = ?
               AND c.status IN (?, ?)
            """, Long.class, contractId,
            CommissionStatus.APPROVED.wireValue(), CommissionStatus.PAID.wireValue());
        return count != null && count > 0;
    }

    private static Long requireId(Commission commission) {
        return commission.id().orElseThrow(() -> new IllegalArgumentException("Commission id is required"));
    }

    private MapSqlParameterSource figureParams(Commission commission) {
        return new MapSqlParameterSource()
            .addValue("configId", commission.configId().orElse(null))
            .addValue("grossBase", commission.grossBaseCommission())
            .addValue("base", commission.baseCommission())
            .addValue("pilot", commission.pilotBonus())
            .addValue("multiYear", commission.multiYearBonus())
            .addValue("upfront", commission.upfrontBonus())
            .addValue("total", commission.totalCommission())
            .addValue("oteApplied", commission.oteApplied() ? 1 : 0);
    }

    private RowMapper<Commission> rowMapper() {
        return this::mapCommission;
    }

    private Commission mapCommission(ResultSet rs, int rowNum) throws SQLException {
        return new Commission(
            Optional.of(rs.getLong("ID")),
            rs.getLong("INVOICE_ID"),
            rs.getLong("AE_ID"),
            Optional.ofNullable(rs.getObject("CONFIG_ID", Long.class)),
            rs.getBigDecimal("GROSS_BASE_COMMISSION"),
            rs.getBigDecimal("BASE_COMMISSION"),
            rs.getBigDecimal("PILOT_BONUS"),
            rs.getBigDecimal("MULTI_YEAR_BONUS"),
            rs.getBigDecimal("UPFRONT_BONUS"),
            rs.getBigDecimal("TOTAL_COMMISSION"),
            rs.getInt("OTE_APPLIED") == 1,
            CommissionStatus.fromWire(rs.getString("STATUS")),
            Optional.ofNullable(rs.getString("APPROVED_BY")),
            JdbcKeys.localDateTime(rs.getTimestamp("APPROVED_AT")),
            Optional.ofNullable(rs.getString("REJECTION_REASON")),
            Optional.ofNullable(rs.getString("PAID_BY")),
            JdbcKeys.localDateTime(rs.getTimestamp("PAID_AT")),
            JdbcKeys.localDateTime(rs.getTimestamp("CREATED_AT")),
            JdbcKeys.localDateTime(rs.getTimestamp("UPDATED_AT"))
        );
    }
}
