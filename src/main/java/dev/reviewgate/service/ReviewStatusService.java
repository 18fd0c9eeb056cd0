package dev.reviewgate.service;

import dev.reviewgate.domain.entity.Review;
import dev.reviewgate.domain.enums.ReviewStatus;
import dev.reviewgate.domain.event.ExternalSyncRequestedEvent;
import dev.reviewgate.domain.valueobject.Actor;
import dev.reviewgate.domain.valueobject.Transition;
import dev.reviewgate.exception.InvalidStatusException;
import dev.reviewgate.exception.ReviewNotFoundException;
import dev.reviewgate.repository.ReviewRepository;
import dev.reviewgate.repository.SlaRuleRepository;
import dev.reviewgate.workflow.SlaCalculator;
import dev.reviewgate.workflow.StatusCatalog;
import dev.reviewgate.workflow.TransitionGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;

/**
 * Command side of the status workflow: guard → SLA → store → publish sync event.
 */
@Service
public class ReviewStatusService {
    private static final Logger log = LoggerFactory.getLogger(ReviewStatusService.class);

    private final ReviewRepository reviewRepository;
    private final SlaRuleRepository slaRuleRepository;
    private final TransitionGuard guard;
    private final StatusCatalog catalog;
    private final SlaCalculator slaCalculator;
    private final StatusStore statusStore;
    private final ApplicationEventPublisher eventPublisher;

    public ReviewStatusService(ReviewRepository reviewRepository, SlaRuleRepository slaRuleRepository,
                               TransitionGuard guard, StatusCatalog catalog, SlaCalculator slaCalculator,
                               StatusStore statusStore, ApplicationEventPublisher eventPublisher) {
        this.reviewRepository = reviewRepository;
        this.slaRuleRepository = slaRuleRepository;
        this.guard = guard;
        this.catalog = catalog;
        this.slaCalculator = slaCalculator;
        this.statusStore = statusStore;
        this.eventPublisher = eventPublisher;
    }

    public Review changeStatus(UUID reviewId, String requestedStatus, Actor actor) {
        ReviewStatus requested = ReviewStatus.parse(requestedStatus)
                .orElseThrow(() -> new InvalidStatusException("newStatus", requestedStatus));
        Review review = reviewRepository.findById(reviewId)
                .orElseThrow(() -> new ReviewNotFoundException(reviewId));

        Transition transition = guard.attemptTransition(review, requested, actor);
        if (transition.isNoop()) {
            log.debug("Review {} already {}, nothing to do", reviewId, requested);
            return review;
        }

        Instant deadline = deadlineOnEntering(transition);
        Review saved = statusStore.apply(review, transition, deadline);

        if (saved.isLinked()) {
            eventPublisher.publishEvent(new ExternalSyncRequestedEvent(
                    saved.getId(), saved.getExternalProjectId(), saved.getStatus(), transition.timestamp()));
        }
        return saved;
    }

    /**
     * Deadline for the step expected to follow the new status, or null when that step has no rule.
     */
    private Instant deadlineOnEntering(Transition transition) {
        ReviewStatus entered = transition.newStatus();
        return catalog.expectedNext(entered)
                .flatMap(next -> slaCalculator.computeDeadline(entered, next, transition.timestamp(),
                        slaRuleRepository.findAll()))
                .orElse(null);
    }
}
