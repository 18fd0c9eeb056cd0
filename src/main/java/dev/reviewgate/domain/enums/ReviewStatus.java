package dev.reviewgate.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle: DRAFT → SUBMITTED → IN_REVIEW → NEEDS_WORK | APPROVED → ARCHIVED
 *
 * <p>The label is the textual value stored in the {@code reviews.status} column and exchanged over HTTP.
 */
public enum ReviewStatus {
    DRAFT("Draft"),
    SUBMITTED("Submitted"),
    IN_REVIEW("In Review"),
    NEEDS_WORK("Needs Work"),
    APPROVED("Approved"),
    ARCHIVED("Archived");

    private final String label;

    ReviewStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Accepts either the stored label ("In Review") or the constant name ("IN_REVIEW").
     * Anything else is rejected rather than passed through.
     */
    public static Optional<ReviewStatus> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(s -> s.label.equalsIgnoreCase(trimmed) || s.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }

    public static ReviewStatus fromLabel(String label) {
        return Arrays.stream(values())
                .filter(s -> s.label.equals(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown review status: " + label));
    }

    @Override
    public String toString() {
        return label;
    }
}
