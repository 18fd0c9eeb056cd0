package dev.reviewgate.domain.valueobject;

import dev.reviewgate.domain.enums.ReviewStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * A status change approved by the guard but not yet persisted.
 * A no-op transition (old == new) is never written.
 */
public record Transition(UUID reviewId, ReviewStatus oldStatus, ReviewStatus newStatus,
                         Actor actor, Instant timestamp) {
    public Transition {
        if (reviewId == null) throw new IllegalArgumentException("reviewId required");
        if (newStatus == null) throw new IllegalArgumentException("newStatus required");
        if (actor == null) throw new IllegalArgumentException("actor required");
        if (timestamp == null) timestamp = Instant.now();
    }

    public boolean isNoop() {
        return oldStatus == newStatus;
    }
}
