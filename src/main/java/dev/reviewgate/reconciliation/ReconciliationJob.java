package dev.reviewgate.reconciliation;

import dev.reviewgate.domain.entity.Review;
import dev.reviewgate.domain.enums.ReviewStatus;
import dev.reviewgate.domain.enums.SyncState;
import dev.reviewgate.infrastructure.kantata.KantataProjectStatus;
import dev.reviewgate.infrastructure.kantata.KantataSyncAdapter;
import dev.reviewgate.repository.ReviewRepository;
import dev.reviewgate.service.StatusSyncService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Cross-checks every linked review against its Kantata workspace.
 *
 * <p>The flow per sweep:
 *
 * <pre>
 *  1. Fan out one read per linked review on the reconciliation pool
 *  2. Reload the review; the list handed in is only a snapshot of which reviews to check
 *  3. Read failure: report UNVERIFIED, do nothing else
 *  4. Kantata says Live but the review is not Approved: reset the workspace, notify people
 *  5. Review's last push failed or never ran: push it again
 *  6. Join all results, one per review, in input order
 * </pre>
 *
 * <p>A failure on one review never aborts the sweep or hides the other results. The pool size caps
 * how many Kantata calls are in flight; request timeouts are enforced by the HTTP client, so queue
 * wait does not count against them.
 */
@Component
public class ReconciliationJob {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationJob.class);

    private final ReviewRepository reviewRepository;
    private final KantataSyncAdapter syncAdapter;
    private final DriftNotifier driftNotifier;
    private final StatusSyncService syncService;
    private final Executor executor;
    private final Timer sweepTimer;
    private final Counter driftCounter;

    public ReconciliationJob(ReviewRepository reviewRepository,
                             KantataSyncAdapter syncAdapter,
                             DriftNotifier driftNotifier,
                             StatusSyncService syncService,
                             @Qualifier("reconciliationExecutor") Executor executor,
                             MeterRegistry meterRegistry) {
        this.reviewRepository = reviewRepository;
        this.syncAdapter = syncAdapter;
        this.driftNotifier = driftNotifier;
        this.syncService = syncService;
        this.executor = executor;
        this.sweepTimer = Timer.builder("reviewgate.reconciliation.duration")
                .description("Time to reconcile all linked reviews against Kantata")
                .register(meterRegistry);
        this.driftCounter = Counter.builder("reviewgate.reconciliation.drift")
                .description("Kantata projects found Live before their review was approved")
                .register(meterRegistry);
    }

    /**
     * Reconciles the given reviews. Unlinked reviews are skipped.
     *
     * @return one result per linked review, never throws for per-review failures
     */
    public List<ReconciliationResult> reconcileAll(List<Review> reviews) {
        Timer.Sample sample = Timer.start();
        try {
            List<CompletableFuture<ReconciliationResult>> futures = reviews.stream()
                    .filter(Review::isLinked)
                    .map(review -> CompletableFuture.supplyAsync(() -> reconcileOne(review), executor)
                            .exceptionally(ex -> ReconciliationResult.unverified(review,
                                    "Reconciliation failed: " + rootMessage(ex))))
                    .toList();

            List<ReconciliationResult> results = futures.stream()
                    .map(CompletableFuture::join)
                    .toList();

            long drifted = results.stream().filter(r -> !r.valid()).count();
            long errors = results.stream().filter(ReconciliationResult::error).count();
            log.info("Reconciled {} linked reviews: {} drifted, {} with errors", results.size(), drifted, errors);
            return results;
        } finally {
            sample.stop(sweepTimer);
        }
    }

    ReconciliationResult reconcileOne(Review snapshot) {
        MDC.put("reviewId", snapshot.getId().toString());
        try {
            Optional<Review> current = reviewRepository.findById(snapshot.getId()).filter(Review::isLinked);
            if (current.isEmpty()) {
                log.info("Review {} was unlinked or removed since the sweep started", snapshot.getId());
                return ReconciliationResult.unverified(snapshot, "Review is no longer linked to a Kantata project");
            }
            Review review = current.get();
            String projectId = review.getExternalProjectId();
            KantataProjectStatus external;
            try {
                external = syncAdapter.fetchProjectStatus(projectId);
            } catch (RuntimeException e) {
                log.warn("Could not read Kantata workspace {}: {}", projectId, e.getMessage());
                return ReconciliationResult.unverified(review, "Could not read Kantata status: " + e.getMessage());
            }

            ReconciliationResult result = isDrift(review, external)
                    ? correctDrift(review, external)
                    : ReconciliationResult.consistent(review, external.statusMessage());
            return result.withNote(retryPendingSync(review));
        } finally {
            MDC.remove("reviewId");
        }
    }

    private boolean isDrift(Review review, KantataProjectStatus external) {
        return syncAdapter.isLive(external) && review.getStatus() != ReviewStatus.APPROVED;
    }

    private ReconciliationResult correctDrift(Review review, KantataProjectStatus external) {
        driftCounter.increment();
        log.warn("Kantata workspace {} is {} but review {} is {}",
                review.getExternalProjectId(), external.statusMessage(), review.getId(), review.getStatus());
        boolean reverted;
        String revertError = null;
        try {
            syncAdapter.revertToSafeDefault(review.getExternalProjectId());
            reverted = true;
        } catch (RuntimeException e) {
            log.error("Could not reset Kantata workspace {}: {}", review.getExternalProjectId(), e.getMessage());
            reverted = false;
            revertError = e.getMessage();
        }

        boolean notified = driftNotifier.notifyDrift(review, external, reverted);
        String notice = notified ? "notification sent" : "notification not sent";
        if (reverted) {
            return ReconciliationResult.corrected(review, external.statusMessage(),
                    "Project was Live before approval; reset to In Development, " + notice);
        }
        return ReconciliationResult.correctionFailed(review, external.statusMessage(),
                "Project was Live before approval; reset failed (" + revertError + "), " + notice);
    }

    private String retryPendingSync(Review review) {
        if (review.getSyncState() != SyncState.FAILED && review.getSyncState() != SyncState.PENDING) {
            return null;
        }
        try {
            // Pushes whatever the store holds at push time, not this reloaded copy
            return syncService.sync(review.getId())
                    .map(outcome -> "Status push retried: " + outcome)
                    .orElse(null);
        } catch (RuntimeException e) {
            log.warn("Status push retry for review {} failed: {}", review.getId(), e.getMessage());
            return "Status push retry failed: " + e.getMessage();
        }
    }

    private static String rootMessage(Throwable ex) {
        Throwable t = ex;
        while (t.getCause() != null) t = t.getCause();
        return t.getMessage();
    }
}
