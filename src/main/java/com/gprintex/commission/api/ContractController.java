package com.gprintex.commission.api;

import com.gprintex.commission.domain.Contract;
import com.gprintex.commission.domain.ContractType;
import com.gprintex.commission.domain.Invoice;
import com.gprintex.commission.domain.PaymentTerms;
import com.gprintex.commission.repository.ContractRepository.ContractFilter;
import com.gprintex.commission.service.ContractService;
import com.gprintex.commission.service.InvoiceService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * REST API controller for Contract operations.
 */
@RestController
@RequestMapping("/api/v1/contracts")
public class ContractController {

    private final ContractService contractService;
    private final InvoiceService invoiceService;

    public ContractController(ContractService contractService, InvoiceService invoiceService) {
        this.contractService = contractService;
        this.invoiceService = invoiceService;
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody ContractRequest request) {
        return contractService.create(request.toContract(null)).fold(
            errors -> ResponseEntity.badRequest().body(errors),
            created -> ResponseEntity.status(HttpStatus.CREATED).body(created)
        );
    }

    @GetMapping("/{id}")
    public ResponseEntity<Contract> getById(@PathVariable Long id) {
        return contractService.findById(id)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public List<Contract> list(
        @RequestParam(required = false) Long aeId,
        @RequestParam(required = false) String clientName
    ) {
        var filter = ContractFilter.all();
        if (aeId != null) filter = filter.withAe(aeId);
        if (clientName != null && !clientName.isBlank()) filter = filter.withClientName(clientName);
        return contractService.findByFilter(filter);
    }

    @GetMapping("/{id}/invoices")
    public List<Invoice> invoices(@PathVariable Long id) {
        return invoiceService.findByContract(id);
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> update(@PathVariable Long id, @RequestBody ContractRequest request) {
        // Path id is authoritative
        return contractService.update(request.toContract(id)).fold(
            errors -> ResponseEntity.badRequest().body(errors),
            ResponseEntity::ok
        );
    }

    public record ContractRequest(
        String clientName,
        Long aeId,
        BigDecimal totalValue,
        BigDecimal acv,
        ContractType contractType,
        Integer contractLength,
        PaymentTerms paymentTerms,
        Boolean isPilot
    ) {
        Contract toContract(Long id) {
            return new Contract(
                Optional.ofNullable(id),
                clientName,
                aeId,
                totalValue,
                acv != null ? acv : totalValue,
                contractType,
                contractLength != null ? contractLength : 1,
                paymentTerms,
                Boolean.TRUE.equals(isPilot),
                Optional.empty(),
                Optional.empty()
            );
        }
    }
}
