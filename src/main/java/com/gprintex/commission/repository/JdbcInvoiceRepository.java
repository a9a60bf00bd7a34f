package com.gprintex.commission.repository;

import com.gprintex.commission.domain.Invoice;
import com.gprintex.commission.domain.RevenueType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JdbcInvoiceRepository implements InvoiceRepository {

    private static final String SELECT = """
        SELECT i.id, i.contract_id, i.invoice_number, i.amount, i.invoice_date, i.revenue_type,
               i.external_invoice_id, i.created_at
          FROM invoices i
        """;

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbc;

    public JdbcInvoiceRepository(JdbcTemplate jdbcTemplate, NamedParameterJdbcTemplate namedJdbc) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbc = namedJdbc;
    }

    @Override
    public Invoice insert(Invoice invoice) {
        var keyHolder = new GeneratedKeyHolder();
        namedJdbc.update("""
            INSERT INTO invoices (contract_id, invoice_number, amount, invoice_date, revenue_type, external_invoice_id)
            VALUES (:contractId, :invoiceNumber, :amount, :invoiceDate, :revenueType, :externalId)
            """, toParams(invoice), keyHolder, new String[]{"ID"});
        return invoice.withId(JdbcKeys.requireKey(keyHolder));
    }

    @Override
    public boolean update(Invoice invoice) {
        var params = toParams(invoice)
            .addValue("id", invoice.id().orElseThrow(() -> new IllegalArgumentException("Invoice id is required")));
        return namedJdbc.update("""
            UPDATE invoices
               SET contract_id = :contractId, invoice_number = :invoiceNumber, amount = :amount,
                   invoice_date = :invoiceDate, revenue_type = :revenueType, external_invoice_id = :externalId
             WHERE id = :id
            """, params) == 1;
    }

    @Override
    public Optional<Invoice> findById(Long id) {
        return jdbcTemplate.query(SELECT + " WHERE i.id = ?", rowMapper(), id)
            .stream()
            .findFirst();
    }

    @Override
    public Optional<Invoice> findByExternalId(String externalInvoiceId) {
        return jdbcTemplate.query(SELECT + " WHERE i.external_invoice_id = ?", rowMapper(), externalInvoiceId)
            .stream()
            .findFirst();
    }

    @Override
    public List<Invoice> findByContract(Long contractId) {
        return jdbcTemplate.query(
            SELECT + " WHERE i.contract_id = ? ORDER BY i.invoice_date, i.id", rowMapper(), contractId);
    }

    @Override
    public List<Invoice> findWithoutCommission() {
        return jdbcTemplate.query(SELECT + """
             WHERE NOT EXISTS (SELECT 1 FROM commissions c WHERE c.invoice_id = i.id)
             ORDER BY i.invoice_date, i.id
            """, rowMapper());
    }

    private MapSqlParameterSource toParams(Invoice invoice) {
        return new MapSqlParameterSource()
            .addValue("contractId", invoice.contractId())
            .addValue("invoiceNumber", invoice.invoiceNumber().orElse(null))
            .addValue("amount", invoice.amount())
            .addValue("invoiceDate", JdbcKeys.date(invoice.invoiceDate()))
            .addValue("revenueType", invoice.revenueType().wireValue())
            .addValue("externalId", invoice.externalInvoiceId().orElse(null));
    }

    private RowMapper<Invoice> rowMapper() {
        return (rs, rowNum) -> new Invoice(
            Optional.of(rs.getLong("ID")),
            rs.getLong("CONTRACT_ID"),
            Optional.ofNullable(rs.getString("INVOICE_NUMBER")),
            rs.getBigDecimal("AMOUNT"),
            rs.getDate("INVOICE_DATE").toLocalDate(),
            RevenueType.fromWire(rs.getString("REVENUE_TYPE")),
            Optional.ofNullable(rs.getString("EXTERNAL_INVOICE_ID")),
            JdbcKeys.localDateTime(rs.getTimestamp("CREATED_AT"))
        );
    }
}
