package dev.reviewgate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Kantata (Mavenlink) API settings. statusFieldId is the custom field mirroring the review status;
 * safeDefaultStatusKey is the workspace status a drifted project is reset to (305 = "In Development").
 */
@ConfigurationProperties(prefix = "reviewgate.kantata")
public record KantataProperties(String baseUrl, String apiToken, String statusFieldId,
                                String liveStatus, int safeDefaultStatusKey,
                                String approvedValue, String inProgressValue,
                                Duration requestTimeout, String workspaceUrlTemplate) {
    public KantataProperties {
        if (baseUrl == null || baseUrl.isBlank()) baseUrl = "https://api.mavenlink.com/api/v1";
        if (liveStatus == null) liveStatus = "Live";
        if (safeDefaultStatusKey <= 0) safeDefaultStatusKey = 305;
        if (approvedValue == null) approvedValue = "Approved";
        if (inProgressValue == null) inProgressValue = "In Progress";
        if (requestTimeout == null) requestTimeout = Duration.ofSeconds(12);
        if (workspaceUrlTemplate == null) workspaceUrlTemplate = "https://app.mavenlink.com/workspaces/%s";
    }

    public String workspaceUrl(String projectId) {
        return workspaceUrlTemplate.formatted(projectId);
    }
}
