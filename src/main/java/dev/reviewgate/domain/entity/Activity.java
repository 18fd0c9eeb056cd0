package dev.reviewgate.domain.entity;

import dev.reviewgate.domain.valueobject.Transition;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Activity feed row. Written best-effort after a status change; JSONB metadata keeps the
 * old/new status pair queryable without a dedicated column per activity kind.
 */
@Entity
@Table(name = "activities", indexes = {
        @Index(name = "idx_activities_review", columnList = "review_id"),
        @Index(name = "idx_activities_created", columnList = "created_at")
})
public class Activity {

    public static final String TYPE_REVIEW = "review";

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(nullable = false, length = 20)
    private String type;

    @Column(nullable = false)
    private String action;

    @Column(nullable = false, length = 1000)
    private String description;

    @Column(length = 500)
    private String link;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "review_id", columnDefinition = "uuid")
    private UUID reviewId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    private Map<String, Object> metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Activity() {
    }

    public static Activity statusChanged(Transition t) {
        Activity a = new Activity();
        a.id = UUID.randomUUID();
        a.type = TYPE_REVIEW;
        a.action = "updated status";
        a.description = "Review status changed from %s to %s".formatted(t.oldStatus(), t.newStatus());
        a.link = "/reviews/" + t.reviewId();
        a.userId = t.actor().id();
        a.reviewId = t.reviewId();
        a.metadata = Map.of(
                "old_status", t.oldStatus() == null ? "" : t.oldStatus().label(),
                "new_status", t.newStatus().label());
        a.createdAt = t.timestamp();
        return a;
    }

    public UUID getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public String getAction() {
        return action;
    }

    public String getDescription() {
        return description;
    }

    public String getLink() {
        return link;
    }

    public String getUserId() {
        return userId;
    }

    public UUID getReviewId() {
        return reviewId;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
