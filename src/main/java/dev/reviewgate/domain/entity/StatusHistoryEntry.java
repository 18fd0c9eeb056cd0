package dev.reviewgate.domain.entity;

import dev.reviewgate.domain.enums.ReviewStatus;
import dev.reviewgate.domain.valueobject.Transition;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit row, one per committed transition. Ordered by {@code changedAt}, the chain for a
 * review replays its current status. {@code oldStatus} is null for the creation entry.
 */
@Entity
@Table(name = "status_history", indexes = {
        @Index(name = "idx_history_review_time", columnList = "review_id, changed_at")
})
public class StatusHistoryEntry {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "review_id", nullable = false, columnDefinition = "uuid")
    private UUID reviewId;

    @Column(name = "old_status", length = 20)
    private ReviewStatus oldStatus;

    @Column(name = "new_status", nullable = false, length = 20)
    private ReviewStatus newStatus;

    @Column(name = "actor_id", nullable = false)
    private String actorId;

    @Column(name = "changed_at", nullable = false, updatable = false)
    private Instant changedAt;

    protected StatusHistoryEntry() {
    }

    public static StatusHistoryEntry of(Transition transition) {
        StatusHistoryEntry e = new StatusHistoryEntry();
        e.id = UUID.randomUUID();
        e.reviewId = transition.reviewId();
        e.oldStatus = transition.oldStatus();
        e.newStatus = transition.newStatus();
        e.actorId = transition.actor().id();
        e.changedAt = transition.timestamp();
        return e;
    }

    public static StatusHistoryEntry creation(Review review) {
        StatusHistoryEntry e = new StatusHistoryEntry();
        e.id = UUID.randomUUID();
        e.reviewId = review.getId();
        e.newStatus = review.getStatus();
        e.actorId = review.getOwnerId();
        e.changedAt = review.getCreatedAt();
        return e;
    }

    public UUID getId() {
        return id;
    }

    public UUID getReviewId() {
        return reviewId;
    }

    public ReviewStatus getOldStatus() {
        return oldStatus;
    }

    public ReviewStatus getNewStatus() {
        return newStatus;
    }

    public String getActorId() {
        return actorId;
    }

    public Instant getChangedAt() {
        return changedAt;
    }
}
