package dev.reviewgate.exception;

import dev.reviewgate.domain.enums.ReviewStatus;
import dev.reviewgate.domain.enums.RoleRequirement;

public class TransitionForbiddenException extends TransitionRejectedException {

    private final RoleRequirement requirement;

    public TransitionForbiddenException(ReviewStatus from, ReviewStatus to, RoleRequirement requirement) {
        super(GuardError.FORBIDDEN, from, to, describe(from, to, requirement));
        this.requirement = requirement;
    }

    public RoleRequirement getRequirement() {
        return requirement;
    }

    private static String describe(ReviewStatus from, ReviewStatus to, RoleRequirement requirement) {
        String who = switch (requirement) {
            case OWNER -> "the review owner";
            case OWNER_OR_ADMIN -> "the review owner or an administrator";
            case ADMIN_ONLY -> "an administrator";
        };
        return "Only %s can move a review from %s to %s".formatted(who, from, to);
    }
}
