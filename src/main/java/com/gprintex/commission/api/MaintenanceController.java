package com.gprintex.commission.api;

import com.gprintex.commission.camel.InvoiceSyncRoute;
import com.gprintex.commission.domain.BatchResult;
import com.gprintex.commission.domain.Commission;
import com.gprintex.commission.service.CommissionEngine;
import com.gprintex.commission.service.InvoiceService;
import io.vavr.control.Try;
import org.apache.camel.ProducerTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Admin API for batch jobs: commission backfill, billing sync and single-invoice recalculation.
 */
@RestController
@RequestMapping("/api/v1/admin/maintenance")
public class MaintenanceController {

    private final InvoiceService invoiceService;
    private final CommissionEngine engine;
    private final ProducerTemplate producerTemplate;

    public MaintenanceController(InvoiceService invoiceService, CommissionEngine engine, ProducerTemplate producerTemplate) {
        this.invoiceService = invoiceService;
        this.engine = engine;
        this.producerTemplate = producerTemplate;
    }

    @PostMapping("/backfill")
    public ResponseEntity<?> backfill() {
        return toResponse(invoiceService.backfillMissingCommissions());
    }

    @PostMapping("/sync-invoices")
    public ResponseEntity<?> syncInvoices() {
        var body = producerTemplate.requestBody(InvoiceSyncRoute.SYNC_ENDPOINT, (Object) null);
        if (body instanceof BatchResult result) {
            return ResponseEntity.ok(result);
        }
        var message = body instanceof Throwable t ? t.getMessage() : String.valueOf(body);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(Map.of("errorCode", "SYNC_FAILED", "message", message));
    }

    @PostMapping("/invoices/{invoiceId}/recalculate")
    public Commission recalculate(@PathVariable Long invoiceId) {
        return engine.recalculate(invoiceId);
    }

    private static ResponseEntity<?> toResponse(Try<BatchResult> result) {
        return result.fold(
            cause -> ResponseEntity.internalServerError()
                .body(Map.of("errorCode", "BATCH_FAILED", "message", String.valueOf(cause.getMessage()))),
            ResponseEntity::ok
        );
    }
}
