package dev.reviewgate.service;

import dev.reviewgate.domain.event.ExternalSyncRequestedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Bridges committed status changes to the Kantata push.
 *
 * <p>Runs after commit (or immediately when there is no surrounding transaction) on the bounded
 * status-sync pool, so the HTTP response for the status change is already on its way. Failures are
 * recorded on the review by {@link StatusSyncService} and picked up by the next reconciliation sweep.
 */
@Component
public class StatusSyncListener {

    private static final Logger log = LoggerFactory.getLogger(StatusSyncListener.class);

    private final StatusSyncService syncService;

    public StatusSyncListener(StatusSyncService syncService) {
        this.syncService = syncService;
    }

    @Async("statusSyncExecutor")
    @TransactionalEventListener(fallbackExecution = true)
    public void onSyncRequested(ExternalSyncRequestedEvent event) {
        MDC.put("reviewId", event.reviewId().toString());
        try {
            log.debug("Syncing review {} ({}) to Kantata project {}",
                    event.reviewId(), event.status(), event.externalProjectId());
            syncService.sync(event.reviewId());
        } catch (RuntimeException e) {
            log.error("Could not record sync outcome for review {}", event.reviewId(), e);
        } finally {
            MDC.remove("reviewId");
        }
    }
}
