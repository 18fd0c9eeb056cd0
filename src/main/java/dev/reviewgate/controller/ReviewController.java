package dev.reviewgate.controller;

import dev.reviewgate.domain.entity.Review;
import dev.reviewgate.domain.valueobject.Actor;
import dev.reviewgate.dto.request.AssignLeadRequest;
import dev.reviewgate.dto.request.CreateReviewRequest;
import dev.reviewgate.dto.request.LinkProjectRequest;
import dev.reviewgate.dto.request.StatusChangeRequest;
import dev.reviewgate.dto.response.HistoryEntryResponse;
import dev.reviewgate.dto.response.ReviewResponse;
import dev.reviewgate.service.ReviewQueryService;
import dev.reviewgate.service.ReviewService;
import dev.reviewgate.service.ReviewStatusService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/reviews")
public class ReviewController {

    private final ReviewService reviewService;
    private final ReviewStatusService statusService;
    private final ReviewQueryService queryService;
    private final ActorResolver actorResolver;

    public ReviewController(ReviewService reviewService, ReviewStatusService statusService,
                            ReviewQueryService queryService, ActorResolver actorResolver) {
        this.reviewService = reviewService;
        this.statusService = statusService;
        this.queryService = queryService;
        this.actorResolver = actorResolver;
    }

    @PostMapping
    public ResponseEntity<ReviewResponse> create(@Valid @RequestBody CreateReviewRequest request,
                                                 Authentication authentication) {
        Actor actor = actorResolver.resolve(authentication);
        Review created = reviewService.createDraft(request, actor);
        return ResponseEntity.created(URI.create("/reviews/" + created.getId()))
                .body(queryService.toResponse(created, actor));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ReviewResponse> getReview(@PathVariable UUID id, Authentication authentication) {
        return ResponseEntity.ok(queryService.findById(id, actorResolver.resolve(authentication)));
    }

    @GetMapping("/{id}/history")
    public ResponseEntity<List<HistoryEntryResponse>> getHistory(@PathVariable UUID id) {
        return ResponseEntity.ok(queryService.history(id));
    }

    /**
     * Moves the review to {@code newStatus}. The Kantata mirror is updated after the response,
     * so a Kantata outage never fails this call; the returned sync state shows it is pending.
     */
    @PatchMapping("/{id}/status")
    public ResponseEntity<ReviewResponse> changeStatus(@PathVariable UUID id,
                                                       @Valid @RequestBody StatusChangeRequest request,
                                                       Authentication authentication) {
        Actor actor = actorResolver.resolve(authentication);
        Review updated = statusService.changeStatus(id, request.newStatus(), actor);
        return ResponseEntity.ok(queryService.toResponse(updated, actor));
    }

    @PutMapping("/{id}/external-project")
    public ResponseEntity<ReviewResponse> linkExternalProject(@PathVariable UUID id,
                                                              @Valid @RequestBody LinkProjectRequest request,
                                                              Authentication authentication) {
        Actor actor = actorResolver.resolve(authentication);
        Review linked = reviewService.linkExternalProject(id, request.externalProjectId(), actor);
        return ResponseEntity.ok(queryService.toResponse(linked, actor));
    }

    @PutMapping("/{id}/lead")
    public ResponseEntity<ReviewResponse> assignLead(@PathVariable UUID id,
                                                     @RequestBody AssignLeadRequest request,
                                                     Authentication authentication) {
        Actor actor = actorResolver.resolve(authentication);
        Review updated = reviewService.assignLead(id, request.leadId(), actor);
        return ResponseEntity.ok(queryService.toResponse(updated, actor));
    }
}
