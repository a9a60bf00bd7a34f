package com.gprintex.commission.handler;

import com.gprintex.commission.client.NotificationClient;
import com.gprintex.commission.domain.CommissionApprovedEvent;
import com.gprintex.commission.repository.AccountExecutiveRepository;
import com.gprintex.commission.repository.CommissionRepository;
import com.gprintex.commission.repository.ContractRepository;
import com.gprintex.commission.repository.InvoiceRepository;
import org.apache.camel.Handler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Event handler for commission events.
 * Used by Camel routes to notify account executives about approvals.
 */
@Component("commissionEventHandler")
public class CommissionEventHandler {

    private static final Logger log = LoggerFactory.getLogger(CommissionEventHandler.class);

    private final CommissionRepository commissions;
    private final InvoiceRepository invoices;
    private final ContractRepository contracts;
    private final AccountExecutiveRepository accountExecutives;
    private final NotificationClient notificationClient;

    public CommissionEventHandler(
        CommissionRepository commissions,
        InvoiceRepository invoices,
        ContractRepository contracts,
        AccountExecutiveRepository accountExecutives,
        NotificationClient notificationClient
    ) {
        this.commissions = commissions;
        this.invoices = invoices;
        this.contracts = contracts;
        this.accountExecutives = accountExecutives;
        this.notificationClient = notificationClient;
    }

    /**
     * Notify the AE of an approved commission. Notification failures are logged and never
     * reach the approval itself.
     *
     * @return whether the notification was delivered
     */
    @Handler
    public boolean onApproved(CommissionApprovedEvent event) {
        try {
            var ae = accountExecutives.findById(event.aeId());
            if (ae.isEmpty()) {
                log.error("Approved commission {} references unknown AE {}", event.commissionId(), event.aeId());
                return false;
            }
            var clientName = commissions.findById(event.commissionId())
                .flatMap(c -> invoices.findById(c.invoiceId()))
                .flatMap(i -> contracts.findById(i.contractId()))
                .map(c -> c.clientName())
                .orElse("unknown client");

            var info = new NotificationClient.AeInfo(event.aeId(), ae.get().name(), ae.get().email());
            var delivered = notificationClient.notifyApproval(event.commissionId(), info, event.totalCommission(), clientName);
            if (!delivered) {
                log.warn("Approval notification for commission {} was not delivered", event.commissionId());
            }
            return delivered;
        } catch (RuntimeException e) {
            log.error("Approval notification for commission {} failed", event.commissionId(), e);
            return false;
        }
    }
}
