package dev.reviewgate.reconciliation;

import dev.reviewgate.dto.response.ReconciliationResponse;
import dev.reviewgate.service.ReconciliationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic reconciliation sweep. Off unless {@code reviewgate.reconciliation.enabled=true};
 * administrators can always trigger a sweep on demand.
 */
@Component
@ConditionalOnProperty(prefix = "reviewgate.reconciliation", name = "enabled", havingValue = "true")
public class ReconciliationScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationScheduler.class);

    private final ReconciliationService reconciliationService;

    public ReconciliationScheduler(ReconciliationService reconciliationService) {
        this.reconciliationService = reconciliationService;
    }

    @Scheduled(cron = "${reviewgate.reconciliation.cron:0 0 * * * *}")
    public void sweep() {
        try {
            ReconciliationResponse response = reconciliationService.runSweep();
            log.info("Scheduled reconciliation done: {} checked, {} corrected, {} invalid",
                    response.checkedCount(), response.correctedCount(), response.invalidCount());
        } catch (RuntimeException e) {
            log.error("Scheduled reconciliation failed: {}", e.getMessage(), e);
        }
    }
}
