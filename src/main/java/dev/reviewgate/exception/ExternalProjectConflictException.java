package dev.reviewgate.exception;

import java.util.UUID;

/** Another review already references the external project. */
public class ExternalProjectConflictException extends RuntimeException {
    public ExternalProjectConflictException(String projectId, UUID linkedReviewId) {
        super("Kantata project %s is already linked to review %s".formatted(projectId, linkedReviewId));
    }
}
