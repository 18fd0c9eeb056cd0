package dev.reviewgate.infrastructure.kantata;

/**
 * Workspace status as reported by Kantata, e.g. key 306 / message "Live".
 */
public record KantataProjectStatus(String projectId, String title, Integer statusKey, String statusMessage) {
    public boolean is(String message) {
        return statusMessage != null && statusMessage.equalsIgnoreCase(message);
    }
}
