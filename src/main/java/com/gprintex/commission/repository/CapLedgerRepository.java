package com.gprintex.commission.repository;

/**
 * Per-AE, per-year ledger rows used to serialize OTE cap read-then-write sequences.
 */
public interface CapLedgerRepository {

    /**
     * Lock the ledger row of (aeId, year) until the current transaction ends, creating it if needed.
     * Must be called inside a transaction.
     */
    void lock(Long aeId, int year);
}
