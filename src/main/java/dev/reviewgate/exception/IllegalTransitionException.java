package dev.reviewgate.exception;

import dev.reviewgate.domain.enums.ReviewStatus;

public class IllegalTransitionException extends TransitionRejectedException {
    public IllegalTransitionException(ReviewStatus from, ReviewStatus to) {
        super(GuardError.ILLEGAL_TRANSITION, from, to,
                "Transition from %s to %s is not allowed".formatted(from, to));
    }
}
