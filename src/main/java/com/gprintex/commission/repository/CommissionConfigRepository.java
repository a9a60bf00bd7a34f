package com.gprintex.commission.repository;

import com.gprintex.commission.domain.CommissionConfig;
import com.gprintex.commission.domain.ConfigStatus;

import java.util.List;
import java.util.Optional;

/**
 * Commission plan catalogue. Rows are never updated in place apart from their status.
 */
public interface CommissionConfigRepository {

    CommissionConfig insert(CommissionConfig config);

    Optional<CommissionConfig> findById(Long id);

    List<CommissionConfig> findAll(Optional<ConfigStatus> status);

    /**
     * Deactivate a config when a newer version replaces it.
     */
    boolean updateStatus(Long id, ConfigStatus status);
}
