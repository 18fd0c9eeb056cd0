package dev.reviewgate.service;

import dev.reviewgate.domain.entity.Review;
import dev.reviewgate.domain.event.ExternalSyncRequestedEvent;
import dev.reviewgate.domain.valueobject.Actor;
import dev.reviewgate.dto.request.CreateReviewRequest;
import dev.reviewgate.exception.ExternalProjectConflictException;
import dev.reviewgate.exception.ReviewAccessDeniedException;
import dev.reviewgate.exception.ReviewNotFoundException;
import dev.reviewgate.repository.ReviewRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Review lifecycle outside of status changes: creation, Kantata linking and lead assignment.
 */
@Service
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewRepository reviewRepository;
    private final StatusStore statusStore;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public ReviewService(ReviewRepository reviewRepository, StatusStore statusStore,
                         ApplicationEventPublisher eventPublisher, Clock clock) {
        this.reviewRepository = reviewRepository;
        this.statusStore = statusStore;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public Review createDraft(CreateReviewRequest request, Actor actor) {
        Review draft = Review.draft(actor.id(), request.title(), request.description(),
                request.graphName(), request.accountName(), clock.instant());
        Review saved = statusStore.create(draft);
        log.info("Review {} created as Draft by {}", saved.getId(), actor.id());
        return saved;
    }

    /**
     * Links the review to a Kantata workspace and schedules the first status push.
     *
     * @throws ExternalProjectConflictException when another review already uses the workspace
     */
    @Transactional
    public Review linkExternalProject(UUID reviewId, String externalProjectId, Actor actor) {
        Review review = load(reviewId);
        requireOwnerOrAdmin(review, actor, "link a Kantata project");

        String projectId = externalProjectId.trim();
        reviewRepository.findByExternalProjectId(projectId)
                .filter(other -> !other.getId().equals(reviewId))
                .ifPresent(other -> {
                    throw new ExternalProjectConflictException(projectId, other.getId());
                });

        if (projectId.equals(review.getExternalProjectId())) {
            return review;
        }
        review.linkExternalProject(projectId, clock.instant());
        Review saved = reviewRepository.save(review);
        log.info("Review {} linked to Kantata project {} by {}", reviewId, projectId, actor.id());

        eventPublisher.publishEvent(new ExternalSyncRequestedEvent(
                saved.getId(), projectId, saved.getStatus(), clock.instant()));
        return saved;
    }

    /**
     * @param leadId the new lead, or null to clear it
     */
    @Transactional
    public Review assignLead(UUID reviewId, String leadId, Actor actor) {
        Review review = load(reviewId);
        requireOwnerOrAdmin(review, actor, "assign a project lead");

        String lead = leadId == null || leadId.isBlank() ? null : leadId.trim();
        review.assignLead(lead, clock.instant());
        log.info("Review {} lead set to {} by {}", reviewId, lead, actor.id());
        return reviewRepository.save(review);
    }

    private Review load(UUID reviewId) {
        return reviewRepository.findById(reviewId).orElseThrow(() -> new ReviewNotFoundException(reviewId));
    }

    private static void requireOwnerOrAdmin(Review review, Actor actor, String action) {
        if (!actor.isAdmin() && !actor.id().equals(review.getOwnerId())) {
            log.warn("{} denied permission to {} on review {}", actor.id(), action, review.getId());
            throw new ReviewAccessDeniedException("Only the review owner or an administrator may " + action);
        }
    }
}
