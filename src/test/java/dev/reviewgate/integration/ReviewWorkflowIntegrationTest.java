package dev.reviewgate.integration;

import dev.reviewgate.domain.entity.Review;
import dev.reviewgate.domain.enums.Role;
import dev.reviewgate.domain.valueobject.Actor;
import dev.reviewgate.dto.request.CreateReviewRequest;
import dev.reviewgate.dto.request.SlaRuleRequest;
import dev.reviewgate.dto.response.HistoryEntryResponse;
import dev.reviewgate.dto.response.ReconciliationResponse;
import dev.reviewgate.infrastructure.kantata.KantataProjectStatus;
import dev.reviewgate.infrastructure.kantata.KantataSyncAdapter;
import dev.reviewgate.infrastructure.kantata.UpsertOutcome;
import dev.reviewgate.reconciliation.ReconciliationOutcome;
import dev.reviewgate.repository.ActivityRepository;
import dev.reviewgate.repository.ReviewRepository;
import dev.reviewgate.service.ReconciliationService;
import dev.reviewgate.service.ReviewQueryService;
import dev.reviewgate.service.ReviewService;
import dev.reviewgate.service.ReviewStatusService;
import dev.reviewgate.service.SlaRuleService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.time.Duration;
import java.util.List;

import static dev.reviewgate.domain.enums.ReviewStatus.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ReviewWorkflowIntegrationTest extends BaseIntegrationTest {

    @Autowired private ReviewService reviewService;
    @Autowired private ReviewStatusService statusService;
    @Autowired private ReviewQueryService queryService;
    @Autowired private SlaRuleService slaRuleService;
    @Autowired private ReconciliationService reconciliationService;
    @Autowired private ReviewRepository reviewRepository;
    @Autowired private ActivityRepository activityRepository;

    @MockitoBean private KantataSyncAdapter syncAdapter;

    private final Actor owner = new Actor("owner-it", Role.MEMBER);
    private final Actor admin = new Actor("admin-it", Role.ADMIN);

    @Test
    void reviewMovesThroughApprovalAndIsMirrored() {
        slaRuleService.replaceAll(List.of(new SlaRuleRequest("Submitted", "In Review", 24)));
        when(syncAdapter.pushStatus(anyString(), any())).thenReturn(UpsertOutcome.CREATED);

        Review review = reviewService.createDraft(
                new CreateReviewRequest("Revenue graph", "Quarterly revenue", "revenue-q3", "Acme"), owner);
        reviewService.linkExternalProject(review.getId(), "it-123", owner);

        Review submitted = statusService.changeStatus(review.getId(), "Submitted", owner);
        assertThat(submitted.getSlaDeadline()).isNotNull();
        assertThat(Duration.between(submitted.getUpdatedAt(), submitted.getSlaDeadline())).isEqualTo(Duration.ofHours(24));

        statusService.changeStatus(review.getId(), "In Review", admin);
        statusService.changeStatus(review.getId(), "In Review", admin);
        statusService.changeStatus(review.getId(), "Approved", admin);

        List<HistoryEntryResponse> history = queryService.history(review.getId());
        assertThat(history).extracting(HistoryEntryResponse::newStatus)
                .containsExactly(DRAFT, SUBMITTED, IN_REVIEW, APPROVED);
        assertThat(history.get(0).oldStatus()).isNull();
        assertThat(activityRepository.findByReviewIdOrderByCreatedAtDesc(review.getId())).hasSize(3);

        verify(syncAdapter, timeout(5000).atLeastOnce()).pushStatus("it-123", APPROVED);
    }

    @Test
    void reconciliationResetsProjectLiveBeforeApproval() {
        when(syncAdapter.pushStatus(anyString(), any())).thenReturn(UpsertOutcome.UPDATED);
        Review review = reviewService.createDraft(
                new CreateReviewRequest("Churn graph", "Monthly churn", "churn", "Acme"), owner);
        reviewService.linkExternalProject(review.getId(), "it-456", owner);
        statusService.changeStatus(review.getId(), "Submitted", owner);
        when(syncAdapter.fetchProjectStatus(anyString()))
                .thenAnswer(inv -> new KantataProjectStatus(inv.getArgument(0), "Project", 305, "In Development"));
        when(syncAdapter.fetchProjectStatus("it-456"))
                .thenReturn(new KantataProjectStatus("it-456", "Churn", 306, "Live"));
        when(syncAdapter.isLive(any())).thenAnswer(inv -> ((KantataProjectStatus) inv.getArgument(0)).is("Live"));

        ReconciliationResponse response = reconciliationService.runSweep();

        assertThat(response.results())
                .filteredOn(r -> r.externalProjectId().equals("it-456"))
                .singleElement()
                .satisfies(r -> {
                    assertThat(r.valid()).isFalse();
                    assertThat(r.outcome()).isEqualTo(ReconciliationOutcome.CORRECTED);
                });
        verify(syncAdapter).revertToSafeDefault("it-456");
        assertThat(reviewRepository.findById(review.getId())).get()
                .extracting(Review::getStatus).isEqualTo(SUBMITTED);
    }
}
