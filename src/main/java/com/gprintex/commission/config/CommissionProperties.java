package com.gprintex.commission.config;

import com.gprintex.commission.domain.CapCountingPolicy;
import com.gprintex.commission.domain.MultiYearBonusPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Commission engine configuration properties.
 */
@ConfigurationProperties(prefix = "commission")
public record CommissionProperties(
    DefaultsProperties defaults,
    OteProperties ote,
    BonusProperties bonus,
    NotificationProperties notification,
    SyncProperties sync
) {
    public CommissionProperties {
        defaults = defaults != null ? defaults : new DefaultsProperties(null, null);
        ote = ote != null ? ote : new OteProperties(null);
        bonus = bonus != null ? bonus : new BonusProperties(null);
        notification = notification != null ? notification : new NotificationProperties(null, null, null, 0);
        sync = sync != null ? sync : new SyncProperties(null, null, null, null, 0, 0, 0);
    }

    /**
     * System default plan applied when an AE has no assignment covering the invoice date.
     */
    public record DefaultsProperties(
        Boolean enabled,
        BigDecimal baseRate
    ) {
        public DefaultsProperties {
            if (enabled == null) enabled = Boolean.TRUE;
            if (baseRate == null) baseRate = new BigDecimal("0.10");
        }
    }

    public record OteProperties(CapCountingPolicy countingPolicy) {
        public OteProperties {
            if (countingPolicy == null) countingPolicy = CapCountingPolicy.REALIZED_ONLY;
        }
    }

    public record BonusProperties(MultiYearBonusPolicy multiYearPolicy) {
        public BonusProperties {
            if (multiYearPolicy == null) multiYearPolicy = MultiYearBonusPolicy.FLAT;
        }
    }

    /**
     * Outbound approval notification endpoint.
     */
    public record NotificationProperties(
        Boolean enabled,
        String baseUrl,
        String path,
        int timeoutMs
    ) {
        public NotificationProperties {
            if (enabled == null) enabled = Boolean.FALSE;
            if (baseUrl == null || baseUrl.isBlank()) baseUrl = "http://localhost:8089";
            if (path == null || path.isBlank()) path = "/notifications/commission-approved";
            if (timeoutMs <= 0) timeoutMs = 5000;
        }
    }

    /**
     * External billing system invoice sync.
     */
    public record SyncProperties(
        Boolean enabled,
        String baseUrl,
        String apiKey,
        String invoicesPath,
        int pageSize,
        long intervalMs,
        int timeoutMs
    ) {
        public SyncProperties {
            if (enabled == null) enabled = Boolean.FALSE;
            if (baseUrl == null || baseUrl.isBlank()) baseUrl = "http://localhost:8090";
            if (invoicesPath == null || invoicesPath.isBlank()) invoicesPath = "/invoices";
            if (pageSize <= 0) pageSize = 100;
            if (intervalMs <= 0) intervalMs = 3_600_000L;
            if (timeoutMs <= 0) timeoutMs = 30000;
        }
    }
}
