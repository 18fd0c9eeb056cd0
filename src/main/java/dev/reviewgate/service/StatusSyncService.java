package dev.reviewgate.service;

import dev.reviewgate.domain.entity.Review;
import dev.reviewgate.domain.enums.SyncState;
import dev.reviewgate.infrastructure.kantata.KantataSyncAdapter;
import dev.reviewgate.repository.ReviewRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Pushes a review's current status to its Kantata project and records the outcome on the review.
 *
 * <p>Always pushes the status as it is in the database at push time, not the status carried by the
 * triggering event, so out-of-order pushes still converge on the latest value.
 */
@Service
public class StatusSyncService {

    private static final Logger log = LoggerFactory.getLogger(StatusSyncService.class);

    private final ReviewRepository reviewRepository;
    private final KantataSyncAdapter syncAdapter;
    private final Clock clock;

    public StatusSyncService(ReviewRepository reviewRepository, KantataSyncAdapter syncAdapter, Clock clock) {
        this.reviewRepository = reviewRepository;
        this.syncAdapter = syncAdapter;
        this.clock = clock;
    }

    public Optional<SyncState> sync(UUID reviewId) {
        Optional<Review> found = reviewRepository.findById(reviewId);
        if (found.isEmpty() || !found.get().isLinked()) {
            log.debug("Review {} missing or not linked, skipping sync", reviewId);
            return Optional.empty();
        }
        return Optional.of(sync(found.get()));
    }

    SyncState sync(Review review) {
        try {
            syncAdapter.pushStatus(review.getExternalProjectId(), review.getStatus());
        } catch (RuntimeException e) {
            log.warn("Sync of review {} to Kantata project {} failed, will retry on next reconciliation: {}",
                    review.getId(), review.getExternalProjectId(), e.getMessage());
            reviewRepository.updateSyncState(review.getId(), SyncState.FAILED, truncate(e.getMessage()), clock.instant());
            return SyncState.FAILED;
        }
        reviewRepository.updateSyncState(review.getId(), SyncState.SYNCED, null, clock.instant());
        return SyncState.SYNCED;
    }

    private static String truncate(String message) {
        if (message == null) return "unknown error";
        return message.length() <= 2000 ? message : message.substring(0, 2000);
    }
}
