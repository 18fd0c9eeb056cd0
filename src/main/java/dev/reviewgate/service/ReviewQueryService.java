package dev.reviewgate.service;

import dev.reviewgate.config.NotificationProperties;
import dev.reviewgate.domain.entity.Review;
import dev.reviewgate.domain.entity.StatusHistoryEntry;
import dev.reviewgate.domain.enums.ReviewStatus;
import dev.reviewgate.domain.valueobject.Actor;
import dev.reviewgate.dto.response.HistoryEntryResponse;
import dev.reviewgate.dto.response.ProjectApprovalResponse;
import dev.reviewgate.dto.response.ReviewResponse;
import dev.reviewgate.exception.ReviewNotFoundException;
import dev.reviewgate.repository.ReviewRepository;
import dev.reviewgate.repository.StatusHistoryRepository;
import dev.reviewgate.workflow.StatusCatalog;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/** Read-side service with read-only transactions. */
@Service
@Transactional(readOnly = true)
public class ReviewQueryService {

    private final ReviewRepository reviewRepository;
    private final StatusHistoryRepository historyRepository;
    private final StatusCatalog catalog;
    private final NotificationProperties notificationProperties;
    private final Clock clock;

    public ReviewQueryService(ReviewRepository reviewRepository, StatusHistoryRepository historyRepository,
                              StatusCatalog catalog, NotificationProperties notificationProperties, Clock clock) {
        this.reviewRepository = reviewRepository;
        this.historyRepository = historyRepository;
        this.catalog = catalog;
        this.notificationProperties = notificationProperties;
        this.clock = clock;
    }

    public ReviewResponse findById(UUID id, Actor viewer) {
        Review review = reviewRepository.findById(id).orElseThrow(() -> new ReviewNotFoundException(id));
        return toResponse(review, viewer);
    }

    public List<HistoryEntryResponse> history(UUID reviewId) {
        if (!reviewRepository.existsById(reviewId)) {
            throw new ReviewNotFoundException(reviewId);
        }
        return historyRepository.findByReviewIdOrderByChangedAtAsc(reviewId).stream()
                .map(ReviewQueryService::toHistory)
                .toList();
    }

    /**
     * Whether the Kantata project may go Live: only when its linked review is Approved.
     *
     * @throws ReviewNotFoundException when no review is linked to the project
     */
    public ProjectApprovalResponse projectApproval(String projectId) {
        Review review = reviewRepository.findByExternalProjectId(projectId)
                .orElseThrow(() -> new ReviewNotFoundException("No review is linked to Kantata project " + projectId));
        boolean approved = review.getStatus() == ReviewStatus.APPROVED;
        String message = approved
                ? "Review is approved; the project may go Live"
                : "Review is %s; the project must stay In Development until it is Approved".formatted(review.getStatus());
        return new ProjectApprovalResponse(projectId, review.getId(), review.getStatus(), approved, message,
                notificationProperties.reviewUrl(review.getId()));
    }

    /**
     * Maps a review for {@code viewer}. Status changes made in this request are visible because the
     * history is read after them.
     */
    public ReviewResponse toResponse(Review review, Actor viewer) {
        List<HistoryEntryResponse> history = historyRepository.findByReviewIdOrderByChangedAtAsc(review.getId())
                .stream().map(ReviewQueryService::toHistory).toList();
        boolean breached = review.getSlaDeadline() != null && clock.instant().isAfter(review.getSlaDeadline());
        return new ReviewResponse(review.getId(), review.getTitle(), review.getDescription(),
                review.getGraphName(), review.getAccountName(), review.getStatus(), review.getOwnerId(),
                review.getLeadId(), review.getExternalProjectId(), review.getSlaDeadline(), breached,
                review.getSyncState(), review.getSyncError(),
                catalog.availableTargets(review.getStatus(), viewer, review.getOwnerId()),
                history, review.getCreatedAt(), review.getUpdatedAt());
    }

    private static HistoryEntryResponse toHistory(StatusHistoryEntry e) {
        return new HistoryEntryResponse(e.getOldStatus(), e.getNewStatus(), e.getActorId(), e.getChangedAt());
    }
}
