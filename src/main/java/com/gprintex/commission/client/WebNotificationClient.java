package com.gprintex.commission.client;

import com.gprintex.commission.config.CommissionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

/**
 * Posts approval notifications to the configured notification service.
 */
@Component
public class WebNotificationClient implements NotificationClient {

    private static final Logger log = LoggerFactory.getLogger(WebNotificationClient.class);

    private final WebClient webClient;
    private final CommissionProperties.NotificationProperties properties;

    public WebNotificationClient(@Qualifier("notificationWebClient") WebClient webClient, CommissionProperties properties) {
        this.webClient = webClient;
        this.properties = properties.notification();
    }

    @Override
    public boolean notifyApproval(Long commissionId, AeInfo ae, BigDecimal amount, String clientName) {
        if (!properties.enabled()) {
            log.debug("Notifications disabled, not sending approval of commission {}", commissionId);
            return false;
        }
        var payload = Map.of(
            "commissionId", commissionId,
            "aeName", ae.name(),
            "aeEmail", ae.email(),
            "amount", amount.toPlainString(),
            "clientName", clientName
        );
        try {
            webClient.post()
                .uri(properties.path())
                .bodyValue(payload)
                .retrieve()
                .toBodilessEntity()
                .timeout(Duration.ofMillis(properties.timeoutMs()))
                .block();
            log.info("Approval notification sent for commission {} to {}", commissionId, ae.email());
            return true;
        } catch (WebClientResponseException e) {
            log.warn("Approval notification for commission {} rejected: status={}", commissionId, e.getStatusCode().value());
            return false;
        } catch (RuntimeException e) {
            log.warn("Approval notification for commission {} failed: {}", commissionId, e.getMessage());
            return false;
        }
    }
}
