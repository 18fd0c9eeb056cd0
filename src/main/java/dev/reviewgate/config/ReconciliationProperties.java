package dev.reviewgate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * concurrency bounds the number of Kantata reads in flight during one sweep.
 */
@ConfigurationProperties(prefix = "reviewgate.reconciliation")
public record ReconciliationProperties(boolean enabled, String cron, int concurrency) {
    public ReconciliationProperties {
        if (cron == null || cron.isBlank()) cron = "0 0 * * * *";
        if (concurrency <= 0) concurrency = 4;
    }
}
