package dev.reviewgate.exception;

import dev.reviewgate.domain.enums.ReviewStatus;

import java.util.Arrays;
import java.util.stream.Collectors;

public class InvalidStatusException extends RuntimeException {

    private final String field;

    public InvalidStatusException(String field, String value) {
        super("Invalid status value '%s'. Must be one of: %s".formatted(value,
                Arrays.stream(ReviewStatus.values()).map(ReviewStatus::label).collect(Collectors.joining(", "))));
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
