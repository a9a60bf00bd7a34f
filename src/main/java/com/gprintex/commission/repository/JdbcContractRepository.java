package com.gprintex.commission.repository;

import com.gprintex.commission.domain.Contract;
import com.gprintex.commission.domain.ContractType;
import com.gprintex.commission.domain.PaymentTerms;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcContractRepository implements ContractRepository {

    private static final String SELECT = """
        SELECT id, client_name, ae_id, total_value, acv, contract_type, contract_length,
               payment_terms, is_pilot, created_at, updated_at
          FROM contracts
        """;

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbc;

    public JdbcContractRepository(JdbcTemplate jdbcTemplate, NamedParameterJdbcTemplate namedJdbc) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbc = namedJdbc;
    }

    @Override
    public Contract insert(Contract contract) {
        var keyHolder = new GeneratedKeyHolder();
        namedJdbc.update("""
            INSERT INTO contracts (
                client_name, ae_id, total_value, acv, contract_type, contract_length, payment_terms, is_pilot
            ) VALUES (
                :clientName, :aeId, :totalValue, :acv, :contractType, :contractLength, :paymentTerms, :isPilot
            )
            """, toParams(contract), keyHolder, new String[]{"ID"});
        return contract.withId(JdbcKeys.requireKey(keyHolder));
    }

    @Override
    public boolean update(Contract contract) {
        var params = toParams(contract)
            .addValue("id", contract.id().orElseThrow(() -> new IllegalArgumentException("Contract id is required")))
            .addValue("updatedAt", Timestamp.valueOf(LocalDateTime.now()));
        return namedJdbc.update("""
            UPDATE contracts
               SET client_name = :clientName, ae_id = :aeId, total_value = :totalValue, acv = :acv,
                   contract_type = :contractType, contract_length = :contractLength,
                   payment_terms = :paymentTerms, is_pilot = :isPilot, updated_at = :updatedAt
             WHERE id = :id
            """, params) == 1;
    }

    @Override
    public Optional<Contract> findById(Long id) {
        return jdbcTemplate.query(SELECT + " WHERE id = ?", rowMapper(), id)
            .stream()
            .findFirst();
    }

    @Override
    public List<Contract> findByClientName(String clientName) {
        return jdbcTemplate.query(
            SELECT + " WHERE LOWER(client_name) = LOWER(?) ORDER BY id", rowMapper(), clientName.trim());
    }

    @Override
    public List<Contract> findByFilter(ContractFilter filter) {
        var params = new MapSqlParameterSource()
            .addValue("aeId", filter.aeId().orElse(null))
            .addValue("clientName", filter.clientName().map(n -> "%" + n.toLowerCase() + "%").orElse(null));
        var sql = new StringBuilder(SELECT).append(" WHERE 1 = 1");
        filter.aeId().ifPresent(id -> sql.append(" AND ae_id = :aeId"));
        filter.clientName().ifPresent(n -> sql.append(" AND LOWER(client_name) LIKE :clientName"));
        sql.append(" ORDER BY id");
        return namedJdbc.query(sql.toString(), params, rowMapper());
    }

    private MapSqlParameterSource toParams(Contract contract) {
        return new MapSqlParameterSource()
            .addValue("clientName", contract.clientName())
            .addValue("aeId", contract.aeId())
            .addValue("totalValue", contract.totalValue())
            .addValue("acv", contract.acv())
            .addValue("contractType", contract.contractType().wireValue())
            .addValue("contractLength", contract.contractLength())
            .addValue("paymentTerms", contract.paymentTerms().wireValue())
            .addValue("isPilot", contract.isPilot() ? 1 : 0);
    }

    private RowMapper<Contract> rowMapper() {
        return (rs, rowNum) -> new Contract(
            Optional.of(rs.getLong("ID")),
            rs.getString("CLIENT_NAME"),
            rs.getLong("AE_ID"),
            rs.getBigDecimal("TOTAL_VALUE"),
            rs.getBigDecimal("ACV"),
            ContractType.fromWire(rs.getString("CONTRACT_TYPE")),
            rs.getInt("CONTRACT_LENGTH"),
            PaymentTerms.fromWire(rs.getString("PAYMENT_TERMS")),
            rs.getInt("IS_PILOT") == 1,
            JdbcKeys.localDateTime(rs.getTimestamp("CREATED_AT")),
            JdbcKeys.localDateTime(rs.getTimestamp("UPDATED_AT"))
        );
    }
}
