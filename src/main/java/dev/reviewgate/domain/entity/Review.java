package dev.reviewgate.domain.entity;

import dev.reviewgate.domain.enums.ReviewStatus;
import dev.reviewgate.domain.enums.SyncState;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Aggregate root for a graph review.
 *
 * Design: status changes only through {@link #applyStatus}, called by the status store after the
 * transition guard has approved the move. Never hard-deleted; ARCHIVED is the end of the line.
 * Optimistic locking (@Version) turns concurrent status writes into a 409 instead of a lost update.
 */
@Entity
@Table(name = "reviews", indexes = {
        @Index(name = "idx_reviews_status", columnList = "status"),
        @Index(name = "idx_reviews_owner", columnList = "owner_id")
})
public class Review {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(nullable = false)
    private String title;

    @Column(length = 4000)
    private String description;

    @Column(name = "graph_name")
    private String graphName;

    @Column(name = "account_name")
    private String accountName;

    @Column(nullable = false, length = 20)
    private ReviewStatus status;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Column(name = "lead_id")
    private String leadId;

    @Column(name = "external_project_id", unique = true)
    private String externalProjectId;

    @Column(name = "sla_deadline")
    private Instant slaDeadline;

    @Enumerated(EnumType.STRING)
    @Column(name = "sync_state", nullable = false, length = 20)
    private SyncState syncState = SyncState.NOT_LINKED;

    @Column(name = "sync_error", length = 2000)
    private String syncError;

    @Column(name = "synced_at")
    private Instant syncedAt;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Review() {
    }

    public static Review draft(String ownerId, String title, String description,
                               String graphName, String accountName, Instant createdAt) {
        if (ownerId == null || ownerId.isBlank()) throw new IllegalArgumentException("ownerId required");
        if (title == null || title.isBlank()) throw new IllegalArgumentException("title required");
        if (createdAt == null) throw new IllegalArgumentException("createdAt required");
        Review r = new Review();
        r.id = UUID.randomUUID();
        r.ownerId = ownerId;
        r.title = title;
        r.description = description;
        r.graphName = graphName;
        r.accountName = accountName;
        r.status = ReviewStatus.DRAFT;
        r.createdAt = createdAt;
        r.updatedAt = r.createdAt;
        return r;
    }

    public void applyStatus(ReviewStatus newStatus, Instant at, Instant deadline) {
        this.status = newStatus;
        this.slaDeadline = deadline;
        this.updatedAt = at;
        if (isLinked()) {
            // Mirror is stale until the sync listener (or the next reconciliation sweep) pushes it
            this.syncState = SyncState.PENDING;
        }
    }

    public void linkExternalProject(String projectId, Instant at) {
        this.externalProjectId = projectId;
        this.syncState = projectId == null ? SyncState.NOT_LINKED : SyncState.PENDING;
        this.syncError = null;
        this.updatedAt = at;
    }

    public void assignLead(String leadId, Instant at) {
        this.leadId = leadId;
        this.updatedAt = at;
    }

    /**
     * Names of the descriptive fields that must be filled in before the review leaves DRAFT.
     */
    public List<String> missingRequiredFields() {
        List<String> missing = new ArrayList<>();
        if (isBlank(title)) missing.add("title");
        if (isBlank(description)) missing.add("description");
        if (isBlank(graphName)) missing.add("graphName");
        if (isBlank(accountName)) missing.add("accountName");
        return missing;
    }

    public boolean isLinked() {
        return externalProjectId != null;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    // Getters
    public UUID getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getGraphName() {
        return graphName;
    }

    public String getAccountName() {
        return accountName;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getLeadId() {
        return leadId;
    }

    public String getExternalProjectId() {
        return externalProjectId;
    }

    public Instant getSlaDeadline() {
        return slaDeadline;
    }

    public SyncState getSyncState() {
        return syncState;
    }

    public String getSyncError() {
        return syncError;
    }

    public Instant getSyncedAt() {
        return syncedAt;
    }

    public Long getVersion() {
        return version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
