package dev.reviewgate.exception;

import dev.reviewgate.domain.enums.ReviewStatus;

import java.util.List;

public class IncompleteReviewException extends TransitionRejectedException {

    private final List<String> missingFields;

    public IncompleteReviewException(ReviewStatus from, ReviewStatus to, List<String> missingFields) {
        super(GuardError.INCOMPLETE_ENTITY, from, to,
                "Review cannot leave %s until these fields are filled in: %s"
                        .formatted(from, String.join(", ", missingFields)));
        this.missingFields = List.copyOf(missingFields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
