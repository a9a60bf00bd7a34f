package com.gprintex.commission.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.gprintex.commission.config.CommissionProperties;
import com.gprintex.commission.domain.ExternalInvoice;
import com.gprintex.commission.domain.RevenueType;
import io.vavr.control.Try;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Client for the external billing system's invoice API.
 * Pages through paid invoices and maps them to {@link ExternalInvoice}.
 */
@Component
public class BillingClient {

    private static final Logger log = LoggerFactory.getLogger(BillingClient.class);
    private static final int MAX_ERROR_BODY_LENGTH = 1000;
    private static final int MAX_PAGES = 1000;

    private final WebClient billingWebClient;
    private final CommissionProperties.SyncProperties properties;

    public BillingClient(@Qualifier("billingWebClient") WebClient billingWebClient, CommissionProperties properties) {
        this.billingWebClient = billingWebClient;
        this.properties = properties.sync();
    }

    /**
     * Fetch all paid invoices, following pagination until a short page is returned.
     */
    public List<ExternalInvoice> fetchPaidInvoices() {
        var result = new ArrayList<ExternalInvoice>();
        for (int page = 1; page <= MAX_PAGES; page++) {
            var response = fetchPage(page).block();
            var data = response == null ? null : response.get("data");
            if (data == null || !data.isArray() || data.isEmpty()) {
                break;
            }
            data.forEach(node -> toInvoice(node).ifPresent(result::add));
            if (data.size() < properties.pageSize()) {
                break;
            }
        }
        log.info("Fetched {} paid invoices from billing system", result.size());
        return result;
    }

    Mono<JsonNode> fetchPage(int page) {
        return billingWebClient.get()
            .uri(uri -> uri.path(properties.invoicesPath())
                .queryParam("status", "paid")
                .queryParam("page", page)
                .queryParam("limit", properties.pageSize())
                .build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(Duration.ofMillis(properties.timeoutMs()))
            .onErrorResume(TimeoutException.class, e -> Mono.error(new BillingApiException(
                "Billing API timed out fetching page " + page, 504, "Read timeout after " + properties.timeoutMs() + "ms")))
            .onErrorResume(WebClientResponseException.class, e -> {
                log.error("Billing API call failed: page={} status={}", page, e.getStatusCode().value());
                return Mono.error(new BillingApiException(
                    "Billing API call failed for page " + page,
                    e.getStatusCode().value(),
                    truncate(e.getResponseBodyAsString())));
            });
    }

    /**
     * Map one invoice node. The payment date, when present, is the commission date.
     */
    static Optional<ExternalInvoice> toInvoice(JsonNode node) {
        var id = text(node, "id");
        var customer = text(node, "customer_name");
        var date = text(node, "paid_date").or(() -> text(node, "invoice_date"));
        if (id.isEmpty() || customer.isEmpty() || date.isEmpty() || !node.hasNonNull("amount")) {
            log.warn("Skipping malformed billing invoice: {}", node);
            return Optional.empty();
        }
        return Try.of(() -> new ExternalInvoice(
                id.get(),
                customer.get(),
                text(node, "invoice_number"),
                new BigDecimal(node.get("amount").asText()),
                LocalDate.parse(date.get().substring(0, Math.min(10, date.get().length()))),
                text(node, "status").orElse(""),
                text(node, "revenue_type").flatMap(v -> Try.of(() -> RevenueType.fromWire(v)).toJavaOptional())
            ))
            .onFailure(e -> log.warn("Skipping billing invoice {}: {}", id.get(), e.getMessage()))
            .toJavaOptional();
    }

    private static Optional<String> text(JsonNode node, String field) {
        return Optional.ofNullable(node.get(field))
            .filter(value -> !value.isNull())
            .map(JsonNode::asText)
            .filter(value -> !value.isBlank());
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_ERROR_BODY_LENGTH ? body : body.substring(0, MAX_ERROR_BODY_LENGTH) + "... [truncated]";
    }

    /**
     * Exception for billing API errors.
     */
    public static class BillingApiException extends RuntimeException {
        private final int statusCode;
        private final String responseBody;

        public BillingApiException(String message, int statusCode, String responseBody) {
            super(message + " [status=" + statusCode + "]");
            this.statusCode = statusCode;
            this.responseBody = responseBody;
        }

        public int getStatusCode() {
            return statusCode;
        }

        public String getResponseBody() {
            return responseBody;
        }
    }
}
