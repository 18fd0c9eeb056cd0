package dev.reviewgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * ReviewGate: review approval workflow with a Kantata mirror.
 *
 * <p>Architecture overview:
 * <pre>
 * PATCH /reviews/{id}/status → TransitionGuard → StatusStore (status, history, activity)
 *   → ExternalSyncRequestedEvent → StatusSyncListener (async) → KantataSyncAdapter
 *
 * POST /admin/reconcile | @Scheduled → ReconciliationJob → [Kantata read per linked review]
 *   → revert drifted projects + DriftNotifier
 * </pre>
 *
 * <p>The local database is the system of record. Kantata is updated best-effort and repaired by
 * the reconciliation sweep.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
@EnableScheduling
public class ReviewGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReviewGateApplication.class, args);
    }
}
