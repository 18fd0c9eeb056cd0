package dev.reviewgate.service;

import dev.reviewgate.domain.entity.Review;
import dev.reviewgate.domain.entity.StatusHistoryEntry;
import dev.reviewgate.domain.enums.Role;
import dev.reviewgate.domain.enums.SyncState;
import dev.reviewgate.domain.event.ExternalSyncRequestedEvent;
import dev.reviewgate.domain.valueobject.Actor;
import dev.reviewgate.dto.request.CreateReviewRequest;
import dev.reviewgate.exception.ExternalProjectConflictException;
import dev.reviewgate.exception.ReviewAccessDeniedException;
import dev.reviewgate.repository.ReviewRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static dev.reviewgate.domain.enums.ReviewStatus.DRAFT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReviewServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-10T09:00:00Z");

    @Mock private ReviewRepository reviewRepository;
    @Mock private StatusStore statusStore;
    @Mock private ApplicationEventPublisher eventPublisher;

    private ReviewService service;
    private Review review;

    private final Actor owner = new Actor("owner-1", Role.MEMBER);
    private final Actor stranger = new Actor("member-2", Role.MEMBER);
    private final Actor admin = new Actor("admin-1", Role.ADMIN);

    @BeforeEach
    void setUp() {
        service = new ReviewService(reviewRepository, statusStore, eventPublisher, Clock.fixed(NOW, ZoneOffset.UTC));
        review = Review.draft("owner-1", "Revenue graph", "desc", "revenue", "Acme", Instant.parse("2025-03-10T08:00:00Z"));
    }

    @Test
    void createsDraftOwnedByCaller() {
        when(statusStore.create(any(Review.class))).thenAnswer(inv -> inv.getArgument(0));

        Review created = service.createDraft(new CreateReviewRequest("New graph", null, null, null), stranger);

        assertThat(created.getOwnerId()).isEqualTo("member-2");
        assertThat(created.getStatus()).isEqualTo(DRAFT);
        assertThat(created.getSyncState()).isEqualTo(SyncState.NOT_LINKED);
    }

    @Test
    @DisplayName("creation time and the first history entry come from the injected clock")
    void draftIsStampedWithServiceClock() {
        when(statusStore.create(any(Review.class))).thenAnswer(inv -> inv.getArgument(0));

        Review created = service.createDraft(new CreateReviewRequest("New graph", null, null, null), owner);

        assertThat(created.getCreatedAt()).isEqualTo(NOW);
        assertThat(created.getUpdatedAt()).isEqualTo(NOW);
        assertThat(StatusHistoryEntry.creation(created).getChangedAt()).isEqualTo(NOW);
    }

    @Nested
    class LinkExternalProject {

        @Test
        void linkingMarksPendingAndRequestsInitialPush() {
            when(reviewRepository.findById(review.getId())).thenReturn(Optional.of(review));
            when(reviewRepository.findByExternalProjectId("123")).thenReturn(Optional.empty());
            when(reviewRepository.save(any(Review.class))).thenAnswer(inv -> inv.getArgument(0));

            Review linked = service.linkExternalProject(review.getId(), " 123 ", owner);

            assertThat(linked.getExternalProjectId()).isEqualTo("123");
            assertThat(linked.getSyncState()).isEqualTo(SyncState.PENDING);
            ArgumentCaptor<ExternalSyncRequestedEvent> event = ArgumentCaptor.forClass(ExternalSyncRequestedEvent.class);
            verify(eventPublisher).publishEvent(event.capture());
            assertThat(event.getValue().reviewId()).isEqualTo(review.getId());
            assertThat(event.getValue().occurredAt()).isEqualTo(NOW);
        }

        @Test
        void projectAlreadyLinkedElsewhereIsAConflict() {
            Review other = Review.draft("owner-9", "Other", "d", "g", "a", Instant.parse("2025-03-10T08:00:00Z"));
            other.linkExternalProject("123", Instant.parse("2025-03-10T08:00:00Z"));
            when(reviewRepository.findById(review.getId())).thenReturn(Optional.of(review));
            when(reviewRepository.findByExternalProjectId("123")).thenReturn(Optional.of(other));

            assertThatThrownBy(() -> service.linkExternalProject(review.getId(), "123", admin))
                    .isInstanceOf(ExternalProjectConflictException.class)
                    .hasMessageContaining(other.getId().toString());
            verify(reviewRepository, never()).save(any());
            verifyNoInteractions(eventPublisher);
        }

        @Test
        void relinkingTheSameProjectIsANoop() {
            review.linkExternalProject("123", Instant.parse("2025-03-10T08:00:00Z"));
            when(reviewRepository.findById(review.getId())).thenReturn(Optional.of(review));
            when(reviewRepository.findByExternalProjectId("123")).thenReturn(Optional.of(review));

            service.linkExternalProject(review.getId(), "123", owner);

            verify(reviewRepository, never()).save(any());
            verifyNoInteractions(eventPublisher);
        }

        @Test
        void onlyOwnerOrAdminMayLink() {
            when(reviewRepository.findById(review.getId())).thenReturn(Optional.of(review));

            assertThatThrownBy(() -> service.linkExternalProject(review.getId(), "123", stranger))
                    .isInstanceOf(ReviewAccessDeniedException.class);
        }
    }

    @Test
    void adminAssignsAndClearsLead() {
        when(reviewRepository.findById(review.getId())).thenReturn(Optional.of(review));
        when(reviewRepository.save(any(Review.class))).thenAnswer(inv -> inv.getArgument(0));

        Review updated = service.assignLead(review.getId(), "lead-7", admin);
        assertThat(updated.getLeadId()).isEqualTo("lead-7");
        assertThat(updated.getUpdatedAt()).isEqualTo(NOW);
        assertThat(service.assignLead(review.getId(), " ", admin).getLeadId()).isNull();
    }
}
