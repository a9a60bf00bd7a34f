package com.gprintex.commission.camel;

import com.gprintex.commission.handler.ApprovalEventRelay;
import org.apache.camel.builder.RouteBuilder;
import org.springframework.stereotype.Component;

/**
 * Camel route delivering approval notifications off the request thread.
 */
@Component
public class NotificationRoute extends RouteBuilder {

    @Override
    public void configure() throws Exception {

        // ====================================================================
        // COMMISSION APPROVED
        // ====================================================================
        from(ApprovalEventRelay.APPROVED_ENDPOINT)
            .routeId("commission-approved-notification")
            .log("Commission approved: ${body.commissionId()} (AE ${body.aeId()}, total ${body.totalCommission()})")
            .bean("commissionEventHandler", "onApproved")
            .choice()
                .when(body().isEqualTo(false))
                    .log("Notification not delivered for approved commission")
            .end();
    }
}
