package com.gprintex.commission.repository;

import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Small JDBC conversion helpers shared by the repositories.
 */
final class JdbcKeys {

    private JdbcKeys() {
    }

    static Long requireKey(KeyHolder keyHolder) {
        var key = keyHolder.getKey();
        if (key == null) {
            throw new DataRetrievalFailureException("Missing generated key from insert");
        }
        return key.longValue();
    }

    static Date date(LocalDate value) {
        return value == null ? null : Date.valueOf(value);
    }

    static Date date(Optional<LocalDate> value) {
        return value.map(Date::valueOf).orElse(null);
    }

    static Timestamp timestamp(Optional<LocalDateTime> value) {
        return value.map(Timestamp::valueOf).orElse(null);
    }

    static Optional<LocalDateTime> localDateTime(Timestamp value) {
        return Optional.ofNullable(value).map(Timestamp::toLocalDateTime);
    }

    static Optional<LocalDate> localDate(Date value) {
        return Optional.ofNullable(value).map(Date::toLocalDate);
    }
}
