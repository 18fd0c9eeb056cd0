package dev.reviewgate.exception;

/** Non-status edits (project link, lead) attempted by someone other than the owner or an admin. */
public class ReviewAccessDeniedException extends RuntimeException {
    public ReviewAccessDeniedException(String message) {
        super(message);
    }
}
