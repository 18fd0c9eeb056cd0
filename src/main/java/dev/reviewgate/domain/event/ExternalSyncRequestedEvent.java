package dev.reviewgate.domain.event;

import dev.reviewgate.domain.enums.ReviewStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Published after a committed status change (or a new project link) on a linked review.
 * Consumed asynchronously by the status sync listener so the caller's response never waits on Kantata.
 */
public record ExternalSyncRequestedEvent(
        UUID reviewId,
        String externalProjectId,
        ReviewStatus status,
        Instant occurredAt
) {
    public ExternalSyncRequestedEvent {
        if (reviewId == null) throw new IllegalArgumentException("reviewId required");
        if (externalProjectId == null) throw new IllegalArgumentException("externalProjectId required");
        if (status == null) throw new IllegalArgumentException("status required");
        if (occurredAt == null) occurredAt = Instant.now();
    }
}
