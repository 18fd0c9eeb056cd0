package dev.reviewgate.service;

import dev.reviewgate.domain.entity.Activity;
import dev.reviewgate.domain.entity.Review;
import dev.reviewgate.domain.entity.StatusHistoryEntry;
import dev.reviewgate.domain.valueobject.Transition;
import dev.reviewgate.repository.ActivityRepository;
import dev.reviewgate.repository.ReviewRepository;
import dev.reviewgate.repository.StatusHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Persists guarded transitions.
 *
 * <p>Deliberately NOT @Transactional. The status row is the primary write and the only one whose
 * failure fails the request. History and activity rows are written afterwards, each on its own;
 * if they fail the status stays changed and the gap is logged for repair. This keeps the behaviour
 * the same whether or not the store can commit several rows atomically.
 */
@Service
public class StatusStore {

    private static final Logger log = LoggerFactory.getLogger(StatusStore.class);

    private final ReviewRepository reviewRepository;
    private final StatusHistoryRepository historyRepository;
    private final ActivityRepository activityRepository;

    public StatusStore(ReviewRepository reviewRepository, StatusHistoryRepository historyRepository,
                       ActivityRepository activityRepository) {
        this.reviewRepository = reviewRepository;
        this.historyRepository = historyRepository;
        this.activityRepository = activityRepository;
    }

    /**
     * @param review the entity the guard evaluated; its version makes a concurrent change fail the save
     */
    public Review apply(Review review, Transition transition, Instant slaDeadline) {
        if (transition.isNoop()) {
            return review;
        }
        if (!review.getId().equals(transition.reviewId()) || review.getStatus() != transition.oldStatus()) {
            throw new IllegalStateException("Transition %s -> %s does not match review %s in status %s".formatted(
                    transition.oldStatus(), transition.newStatus(), review.getId(), review.getStatus()));
        }

        review.applyStatus(transition.newStatus(), transition.timestamp(), slaDeadline);
        Review saved = reviewRepository.save(review);
        log.info("Review {} status {} -> {} by {}", saved.getId(),
                transition.oldStatus(), transition.newStatus(), transition.actor().id());

        try {
            historyRepository.save(StatusHistoryEntry.of(transition));
        } catch (RuntimeException e) {
            log.error("AUDIT GAP: review {} moved {} -> {} at {} but the history entry was not written",
                    saved.getId(), transition.oldStatus(), transition.newStatus(), transition.timestamp(), e);
        }

        try {
            activityRepository.save(Activity.statusChanged(transition));
        } catch (RuntimeException e) {
            log.warn("Activity record for review {} status change not written: {}", saved.getId(), e.getMessage());
        }
        return saved;
    }

    /**
     * Stores a new draft and its creation history entry (old status null).
     */
    public Review create(Review draft) {
        Review saved = reviewRepository.save(draft);
        try {
            historyRepository.save(StatusHistoryEntry.creation(saved));
        } catch (RuntimeException e) {
            log.error("AUDIT GAP: review {} created but its creation history entry was not written", saved.getId(), e);
        }
        return saved;
    }
}
