package com.gprintex.commission.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.LocalDateTime;

@Repository
public class JdbcCapLedgerRepository implements CapLedgerRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcCapLedgerRepository.class);

    private static final String TOUCH =
        "UPDATE ote_ledger SET last_locked_at = ? WHERE ae_id = ? AND cap_year = ?";

    private final JdbcTemplate jdbcTemplate;

    public JdbcCapLedgerRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void lock(Long aeId, int year) {
        // The row lock taken by the UPDATE is held until commit or rollback.
        if (touch(aeId, year) == 1) {
            return;
        }
        try {
            jdbcTemplate.update(
                "INSERT INTO ote_ledger (ae_id, cap_year, last_locked_at) VALUES (?, ?, ?)",
                aeId, year, now());
        } catch (DuplicateKeyException e) {
            log.debug("Ledger row for AE {} / {} created concurrently, locking existing row", aeId, year);
            if (touch(aeId, year) != 1) {
                throw new IllegalStateException("Ledger row for AE " + aeId + " / " + year + " vanished", e);
            }
        }
    }

    private int touch(Long aeId, int year) {
        return jdbcTemplate.update(TOUCH, now(), aeId, year);
    }

    private static Timestamp now() {
        return Timestamp.valueOf(LocalDateTime.now());
    }
}
