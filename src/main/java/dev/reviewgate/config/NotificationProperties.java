package dev.reviewgate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reviewgate.notifications")
public record NotificationProperties(boolean enabled, String from, String appBaseUrl) {
    public NotificationProperties {
        if (from == null || from.isBlank()) from = "reviewgate@localhost";
        if (appBaseUrl == null || appBaseUrl.isBlank()) appBaseUrl = "http://localhost:8080";
    }

    public String reviewUrl(Object reviewId) {
        return appBaseUrl + "/reviews/" + reviewId;
    }
}
