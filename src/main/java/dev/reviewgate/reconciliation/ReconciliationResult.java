package dev.reviewgate.reconciliation;

import dev.reviewgate.domain.entity.Review;
import dev.reviewgate.domain.enums.ReviewStatus;

import java.util.UUID;

/**
 * Per-review outcome of one sweep. Not persisted.
 *
 * <p>{@code valid} is false only when drift was actually observed. A failed read is reported as
 * valid with {@code error} set: absence of information is never treated as drift.
 */
public record ReconciliationResult(
        UUID reviewId,
        String externalProjectId,
        String externalStatus,
        ReviewStatus internalStatus,
        boolean valid,
        ReconciliationOutcome outcome,
        boolean error,
        String message
) {
    public static ReconciliationResult consistent(Review review, String externalStatus) {
        return new ReconciliationResult(review.getId(), review.getExternalProjectId(), externalStatus,
                review.getStatus(), true, ReconciliationOutcome.CONSISTENT, false, "Status is consistent");
    }

    public static ReconciliationResult corrected(Review review, String externalStatus, String message) {
        return new ReconciliationResult(review.getId(), review.getExternalProjectId(), externalStatus,
                review.getStatus(), false, ReconciliationOutcome.CORRECTED, false, message);
    }

    public static ReconciliationResult correctionFailed(Review review, String externalStatus, String message) {
        return new ReconciliationResult(review.getId(), review.getExternalProjectId(), externalStatus,
                review.getStatus(), false, ReconciliationOutcome.CORRECTION_FAILED, true, message);
    }

    public static ReconciliationResult unverified(Review review, String message) {
        return new ReconciliationResult(review.getId(), review.getExternalProjectId(), null,
                review.getStatus(), true, ReconciliationOutcome.UNVERIFIED, true, message);
    }

    public ReconciliationResult withNote(String note) {
        if (note == null || note.isBlank()) return this;
        return new ReconciliationResult(reviewId, externalProjectId, externalStatus, internalStatus,
                valid, outcome, error, message + ". " + note);
    }
}
