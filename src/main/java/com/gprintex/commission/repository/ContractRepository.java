package com.gprintex.commission.repository;

import com.gprintex.commission.domain.Contract;

import java.util.List;
import java.util.Optional;

/**
 * Repository for contracts.
 */
public interface ContractRepository {

    // ========================================================================
    // INSERT / UPDATE
    // ========================================================================

    Contract insert(Contract contract);

    /**
     * Update the commission-relevant terms of a contract.
     * @return true when the row existed
     */
    boolean update(Contract contract);

    // ========================================================================
    // QUERY OPERATIONS
    // ========================================================================

    Optional<Contract> findById(Long id);

    /**
     * Case-insensitive match on client name, used to map external invoices to contracts.
     */
    List<Contract> findByClientName(String clientName);

    List<Contract> findByFilter(ContractFilter filter);

    // ========================================================================
    // FILTER RECORD
    // ========================================================================

    record ContractFilter(
        Optional<Long> aeId,
        Optional<String> clientName
    ) {
        public static ContractFilter all() {
            return new ContractFilter(Optional.empty(), Optional.empty());
        }

        public ContractFilter withAe(Long aeId) {
            return new ContractFilter(Optional.ofNullable(aeId), clientName);
        }

        public ContractFilter withClientName(String name) {
            return new ContractFilter(aeId, Optional.ofNullable(name));
        }
    }
}
