package com.gprintex.commission.exception;

import java.time.LocalDate;

/**
 * No assignment covers the date and no system default plan is available.
 * Fatal for the calculation; the invoice stays without a commission and can be backfilled later.
 */
public class ConfigNotFoundException extends CommissionException {

    private final Long aeId;
    private final LocalDate onDate;

    public ConfigNotFoundException(Long aeId, LocalDate onDate) {
        super("CONFIG_NOT_FOUND", "No commission config resolvable for AE " + aeId + " on " + onDate);
        this.aeId = aeId;
        this.onDate = onDate;
    }

    public ConfigNotFoundException(Long configId) {
        super("CONFIG_NOT_FOUND", "Commission config " + configId + " does not exist");
        this.aeId = null;
        this.onDate = null;
    }

    public Long getAeId() {
        return aeId;
    }

    public LocalDate getOnDate() {
        return onDate;
    }
}
