package com.gprintex.commission.camel;

import com.gprintex.commission.config.CommissionProperties;
import org.apache.camel.builder.RouteBuilder;
import org.springframework.stereotype.Component;

/**
 * Camel routes for importing paid invoices from the billing system,
 * on a timer and on demand.
 */
@Component
public class InvoiceSyncRoute extends RouteBuilder {

    public static final String SYNC_ENDPOINT = "direct:invoice-sync";

    private final CommissionProperties properties;

    public InvoiceSyncRoute(CommissionProperties properties) {
        this.properties = properties;
    }

    @Override
    public void configure() throws Exception {
        var sync = properties.sync();

        // ====================================================================
        // SCHEDULED SYNC
        // ====================================================================
        from("timer:invoice-sync?delay=" + sync.intervalMs() + "&period=" + sync.intervalMs())
            .routeId("invoice-sync-timer")
            .autoStartup(sync.enabled())
            .to(SYNC_ENDPOINT);

        // ====================================================================
        // SYNC
        // ====================================================================
        from(SYNC_ENDPOINT)
            .routeId("invoice-sync")
            .log("Starting invoice sync from billing system")
            .bean("invoiceSyncService", "syncPaidInvoices")
            .choice()
                .when(simple("${body.isFailure()}"))
                    .log("Invoice sync failed: ${body.getCause().getMessage()}")
                    .setHeader("error", simple("${body.getCause().getMessage()}"))
                    .transform(simple("${body.getCause()}"))
                .otherwise()
                    .transform(simple("${body.get()}"))
                    .log("Invoice sync done: created=${body.createdCount()} skipped=${body.skippedCount()} failed=${body.failedCount()}")
            .end();
    }
}
