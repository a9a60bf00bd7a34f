package com.gprintex.commission.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Commission joined with its invoice and contract, as shown in statements and approval queues.
 */
public record CommissionDetails(
    Commission commission,
    String clientName,
    String aeName,
    LocalDate invoiceDate,
    BigDecimal invoiceAmount,
    RevenueType revenueType
) {
}
