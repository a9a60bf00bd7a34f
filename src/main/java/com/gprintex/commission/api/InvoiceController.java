package com.gprintex.commission.api;

import com.gprintex.commission.domain.Invoice;
import com.gprintex.commission.domain.InvoiceResult;
import com.gprintex.commission.domain.RevenueType;
import com.gprintex.commission.service.InvoiceService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * REST API controller for invoices. Creating an invoice calculates its commission.
 */
@RestController
@RequestMapping("/api/v1/invoices")
public class InvoiceController {

    private final InvoiceService invoiceService;

    public InvoiceController(InvoiceService invoiceService) {
        this.invoiceService = invoiceService;
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody InvoiceRequest request) {
        return invoiceService.create(request.toInvoice(null)).fold(
            errors -> ResponseEntity.badRequest().body(errors),
            created -> ResponseEntity.status(HttpStatus.CREATED).body(created)
        );
    }

    @GetMapping("/{id}")
    public ResponseEntity<InvoiceResult> getById(@PathVariable Long id) {
        return invoiceService.findById(id)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{id}")
    public InvoiceResult update(@PathVariable Long id, @RequestBody InvoiceRequest request) {
        return invoiceService.update(request.toInvoice(id));
    }

    public record InvoiceRequest(
        Long contractId,
        String invoiceNumber,
        BigDecimal amount,
        LocalDate invoiceDate,
        RevenueType revenueType,
        String externalInvoiceId
    ) {
        Invoice toInvoice(Long id) {
            return new Invoice(
                Optional.ofNullable(id),
                contractId,
                Optional.ofNullable(invoiceNumber),
                amount,
                invoiceDate,
                revenueType,
                Optional.ofNullable(externalInvoiceId),
                Optional.empty()
            );
        }
    }
}
