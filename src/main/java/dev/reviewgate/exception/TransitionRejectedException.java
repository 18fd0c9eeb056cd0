package dev.reviewgate.exception;

import dev.reviewgate.domain.enums.ReviewStatus;

/**
 * Raised by the transition guard before anything is written.
 */
public abstract class TransitionRejectedException extends RuntimeException {

    private final GuardError error;
    private final ReviewStatus from;
    private final ReviewStatus to;

    protected TransitionRejectedException(GuardError error, ReviewStatus from, ReviewStatus to, String message) {
        super(message);
        this.error = error;
        this.from = from;
        this.to = to;
    }

    public GuardError getError() {
        return error;
    }

    public ReviewStatus getFrom() {
        return from;
    }

    public ReviewStatus getTo() {
        return to;
    }
}
