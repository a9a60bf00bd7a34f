package com.gprintex.commission.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gprintex.commission.config.CommissionProperties;
import com.gprintex.commission.domain.RevenueType;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BillingClientTests {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void toInvoice_prefersPaidDate() throws Exception {
        var node = objectMapper.readTree("""
            {"id": "inv_1", "customer_name": "Acme", "invoice_number": "A-1", "amount": "1250.50",
             "status": "paid", "invoice_date": "2025-01-20", "paid_date": "2025-02-03T10:15:00Z"}
            """);

        var invoice = BillingClient.toInvoice(node).orElseThrow();

        assertEquals("inv_1", invoice.externalId());
        assertEquals(LocalDate.of(2025, 2, 3), invoice.invoiceDate());
        assertEquals(new BigDecimal("1250.50"), invoice.amount());
        assertEquals(Optional.of("A-1"), invoice.invoiceNumber());
        assertTrue(invoice.isPaid());
    }

    @Test
    void toInvoice_fallsBackToInvoiceDateAndParsesRevenueType() throws Exception {
        var node = objectMapper.readTree("""
            {"id": "inv_2", "customer_name": "Acme", "amount": 99, "status": "PAID",
             "invoice_date": "2025-03-01", "paid_date": null, "revenue_type": "service"}
            """);

        var invoice = BillingClient.toInvoice(node).orElseThrow();

        assertEquals(LocalDate.of(2025, 3, 1), invoice.invoiceDate());
        assertEquals(Optional.of(RevenueType.SERVICE), invoice.revenueType());
    }

    @Test
    void toInvoice_skipsMalformedRecords() throws Exception {
        assertTrue(BillingClient.toInvoice(objectMapper.readTree("""
            {"id": "inv_3", "amount": 10, "invoice_date": "2025-01-01"}
            """)).isEmpty());
        assertTrue(BillingClient.toInvoice(objectMapper.readTree("""
            {"id": "inv_4", "customer_name": "Acme", "amount": "ten", "invoice_date": "2025-01-01"}
            """)).isEmpty());
        assertTrue(BillingClient.toInvoice(objectMapper.readTree("""
            {"id": "inv_5", "customer_name": "Acme", "amount": 10, "invoice_date": "yesterday"}
            """)).isEmpty());
    }

    @Test
    void fetchPaidInvoices_followsPaginationUntilShortPage() {
        var requestedUris = new ArrayList<String>();
        var pages = List.of(
            page("inv_1", "inv_2"),
            page("inv_3")
        );
        var webClient = WebClient.builder()
            .baseUrl("http://billing.test")
            .exchangeFunction(request -> {
                requestedUris.add(request.url().toString());
                var body = pages.get(requestedUris.size() - 1);
                return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
            })
            .build();
        var client = new BillingClient(webClient, properties(2));

        var invoices = client.fetchPaidInvoices();

        assertEquals(3, invoices.size());
        assertEquals(2, requestedUris.size());
        assertTrue(requestedUris.get(0).contains("status=paid"));
        assertTrue(requestedUris.get(1).contains("page=2"));
        assertTrue(requestedUris.get(1).contains("limit=2"));
    }

    @Test
    void fetchPaidInvoices_httpErrorBecomesBillingApiException() {
        var webClient = WebClient.builder()
            .baseUrl("http://billing.test")
            .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body("{\"error\":\"bad key\"}")
                .build()))
            .build();
        var client = new BillingClient(webClient, properties(100));

        var ex = assertThrows(BillingClient.BillingApiException.class, client::fetchPaidInvoices);

        assertEquals(401, ex.getStatusCode());
        assertTrue(ex.getResponseBody().contains("bad key"));
    }

    private static String page(String... ids) {
        var data = new StringBuilder();
        for (var id : ids) {
            if (data.length() > 0) data.append(',');
            data.append("{\"id\":\"").append(id).append("\",\"customer_name\":\"Acme\",\"amount\":\"100.00\",")
                .append("\"status\":\"paid\",\"invoice_date\":\"2025-01-15\"}");
        }
        return "{\"data\":[" + data + "],\"page\":1}";
    }

    private static CommissionProperties properties(int pageSize) {
        return new CommissionProperties(null, null, null, null,
            new CommissionProperties.SyncProperties(true, "http://billing.test", "key", "/invoices", pageSize, 0, 5000));
    }
}
