package dev.reviewgate.exception;

import java.util.UUID;

public class ReviewNotFoundException extends RuntimeException {
    public ReviewNotFoundException(UUID id) {
        super("Review not found: " + id);
    }

    public ReviewNotFoundException(String message) {
        super(message);
    }
}
