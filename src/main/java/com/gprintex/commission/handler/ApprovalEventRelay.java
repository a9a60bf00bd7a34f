package com.gprintex.commission.handler;

import com.gprintex.commission.domain.CommissionApprovedEvent;
import org.apache.camel.ProducerTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Hands approval events to the notification route once the approving transaction has committed.
 * A rolled back approval never produces a notification.
 */
@Component
public class ApprovalEventRelay {

    public static final String APPROVED_ENDPOINT = "seda:commission-approved";

    private static final Logger log = LoggerFactory.getLogger(ApprovalEventRelay.class);

    private final ProducerTemplate producerTemplate;

    public ApprovalEventRelay(ProducerTemplate producerTemplate) {
        this.producerTemplate = producerTemplate;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onApproved(CommissionApprovedEvent event) {
        try {
            producerTemplate.sendBody(APPROVED_ENDPOINT, event);
        } catch (RuntimeException e) {
            log.error("Could not queue approval notification for commission {}", event.commissionId(), e);
        }
    }
}
