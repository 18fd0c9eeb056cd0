package dev.reviewgate.service;

import dev.reviewgate.domain.entity.Review;
import dev.reviewgate.domain.entity.SlaRule;
import dev.reviewgate.domain.enums.ReviewStatus;
import dev.reviewgate.domain.enums.Role;
import dev.reviewgate.domain.enums.SyncState;
import dev.reviewgate.domain.event.ExternalSyncRequestedEvent;
import dev.reviewgate.domain.valueobject.Actor;
import dev.reviewgate.exception.InvalidStatusException;
import dev.reviewgate.exception.ReviewNotFoundException;
import dev.reviewgate.exception.TransitionForbiddenException;
import dev.reviewgate.repository.ActivityRepository;
import dev.reviewgate.repository.ReviewRepository;
import dev.reviewgate.repository.SlaRuleRepository;
import dev.reviewgate.repository.StatusHistoryRepository;
import dev.reviewgate.workflow.SlaCalculator;
import dev.reviewgate.workflow.StatusCatalog;
import dev.reviewgate.workflow.TransitionGuard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static dev.reviewgate.domain.enums.ReviewStatus.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReviewStatusServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-10T09:00:00Z");

    @Mock private ReviewRepository reviewRepository;
    @Mock private StatusHistoryRepository historyRepository;
    @Mock private ActivityRepository activityRepository;
    @Mock private SlaRuleRepository slaRuleRepository;
    @Mock private ApplicationEventPublisher eventPublisher;

    private ReviewStatusService service;

    private final Actor owner = new Actor("owner-1", Role.MEMBER);
    private final Actor admin = new Actor("admin-1", Role.ADMIN);

    @BeforeEach
    void setUp() {
        StatusCatalog catalog = new StatusCatalog();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        StatusStore store = new StatusStore(reviewRepository, historyRepository, activityRepository);
        service = new ReviewStatusService(reviewRepository, slaRuleRepository, new TransitionGuard(catalog, clock),
                catalog, new SlaCalculator(), store, eventPublisher);
    }

    @Test
    void submitSetsDeadlineForTheNextStep() {
        Review review = review(DRAFT);
        stubLoadAndSave(review);
        when(slaRuleRepository.findAll()).thenReturn(List.of(SlaRule.of(SUBMITTED, IN_REVIEW, 24)));

        Review updated = service.changeStatus(review.getId(), "Submitted", owner);

        assertThat(updated.getStatus()).isEqualTo(SUBMITTED);
        assertThat(updated.getSlaDeadline()).isEqualTo(NOW.plus(Duration.ofHours(24)));
        verify(historyRepository, times(1)).save(any());
    }

    @Test
    void enteringStatusWithoutExpectedNextStepClearsDeadline() {
        Review review = review(IN_REVIEW);
        review.applyStatus(IN_REVIEW, NOW.minusSeconds(60), NOW.plusSeconds(3600));
        stubLoadAndSave(review);

        Review updated = service.changeStatus(review.getId(), "APPROVED", admin);

        assertThat(updated.getStatus()).isEqualTo(APPROVED);
        assertThat(updated.getSlaDeadline()).isNull();
        verifyNoInteractions(slaRuleRepository);
    }

    @Test
    @DisplayName("same status twice: no history, no sync event")
    void noopWritesNothingAndPublishesNothing() {
        Review review = review(SUBMITTED);
        review.linkExternalProject("123", Instant.parse("2025-03-10T08:00:00Z"));
        when(reviewRepository.findById(review.getId())).thenReturn(Optional.of(review));

        Review result = service.changeStatus(review.getId(), "Submitted", owner);

        assertThat(result.getStatus()).isEqualTo(SUBMITTED);
        verify(reviewRepository, never()).save(any());
        verifyNoInteractions(historyRepository, activityRepository, eventPublisher);
    }

    @Test
    void linkedReviewPublishesSyncRequestAndIsMarkedPending() {
        Review review = review(IN_REVIEW);
        review.linkExternalProject("123", Instant.parse("2025-03-10T08:00:00Z"));
        stubLoadAndSave(review);

        Review updated = service.changeStatus(review.getId(), "Approved", admin);

        ArgumentCaptor<ExternalSyncRequestedEvent> event = ArgumentCaptor.forClass(ExternalSyncRequestedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().externalProjectId()).isEqualTo("123");
        assertThat(event.getValue().status()).isEqualTo(APPROVED);
        assertThat(updated.getSyncState()).isEqualTo(SyncState.PENDING);
    }

    @Test
    void unlinkedReviewPublishesNothing() {
        Review review = review(DRAFT);
        stubLoadAndSave(review);

        service.changeStatus(review.getId(), "Submitted", owner);

        verifyNoInteractions(eventPublisher);
    }

    @Test
    void forbiddenTransitionWritesNothing() {
        Review review = review(IN_REVIEW);
        when(reviewRepository.findById(review.getId())).thenReturn(Optional.of(review));

        assertThatThrownBy(() -> service.changeStatus(review.getId(), "Approved", owner))
                .isInstanceOf(TransitionForbiddenException.class);
        verify(reviewRepository, never()).save(any());
        verifyNoInteractions(historyRepository, eventPublisher);
    }

    @Test
    void unknownStatusValueIsRejectedBeforeLookup() {
        UUID id = UUID.randomUUID();

        assertThatThrownBy(() -> service.changeStatus(id, "Shipped", admin))
                .isInstanceOf(InvalidStatusException.class)
                .satisfies(e -> assertThat(((InvalidStatusException) e).getField()).isEqualTo("newStatus"));
        verifyNoInteractions(reviewRepository);
    }

    @Test
    void unknownReviewIsNotFound() {
        UUID id = UUID.randomUUID();
        when(reviewRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.changeStatus(id, "Submitted", owner))
                .isInstanceOf(ReviewNotFoundException.class);
    }

    private void stubLoadAndSave(Review review) {
        when(reviewRepository.findById(review.getId())).thenReturn(Optional.of(review));
        when(reviewRepository.save(any(Review.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private static Review review(ReviewStatus status) {
        Review review = Review.draft("owner-1", "Revenue graph", "Quarterly revenue", "revenue-q3", "Acme", Instant.parse("2025-03-10T08:00:00Z"));
        if (status != DRAFT) {
            review.applyStatus(status, NOW.minusSeconds(3600), null);
        }
        return review;
    }
}
