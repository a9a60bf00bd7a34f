package com.gprintex.commission.client;

import java.math.BigDecimal;

/**
 * Outbound approval notification. Best-effort: implementations report failure through the return value.
 */
public interface NotificationClient {

    /**
     * @return true when the notification was accepted by the downstream service
     */
    boolean notifyApproval(Long commissionId, AeInfo ae, BigDecimal amount, String clientName);

    record AeInfo(Long id, String name, String email) {
    }
}
