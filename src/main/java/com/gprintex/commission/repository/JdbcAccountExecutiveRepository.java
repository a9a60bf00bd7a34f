package com.gprintex.commission.repository;

import com.gprintex.commission.domain.AccountExecutive;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JdbcAccountExecutiveRepository implements AccountExecutiveRepository {

    private static final String SELECT = "SELECT id, name, email, active FROM account_executives";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbc;

    public JdbcAccountExecutiveRepository(JdbcTemplate jdbcTemplate, NamedParameterJdbcTemplate namedJdbc) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbc = namedJdbc;
    }

    @Override
    public AccountExecutive insert(AccountExecutive ae) {
        var params = new MapSqlParameterSource()
            .addValue("name", ae.name())
            .addValue("email", ae.email())
            .addValue("active", ae.active() ? 1 : 0);
        var keyHolder = new GeneratedKeyHolder();
        namedJdbc.update(
            "INSERT INTO account_executives (name, email, active) VALUES (:name, :email, :active)",
            params, keyHolder, new String[]{"ID"}
        );
        return ae.withId(JdbcKeys.requireKey(keyHolder));
    }

    @Override
    public Optional<AccountExecutive> findById(Long id) {
        return jdbcTemplate.query(SELECT + " WHERE id = ?", rowMapper(), id)
            .stream()
            .findFirst();
    }

    @Override
    public Optional<AccountExecutive> findByEmail(String email) {
        return jdbcTemplate.query(SELECT + " WHERE LOWER(email) = LOWER(?)", rowMapper(), email)
            .stream()
            .findFirst();
    }

    @Override
    public List<AccountExecutive> findAll() {
        return jdbcTemplate.query(SELECT + " ORDER BY name", rowMapper());
    }

    @Override
    public boolean exists(Long id) {
        var count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM account_executives WHERE id = ?", Long.class, id);
        return count != null && count > 0;
    }

    private RowMapper<AccountExecutive> rowMapper() {
        return (rs, rowNum) -> new AccountExecutive(
            Optional.of(rs.getLong("ID")),
            rs.getString("NAME"),
            rs.getString("EMAIL"),
            rs.getInt("ACTIVE") == 1
        );
    }
}
