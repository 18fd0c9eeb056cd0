package dev.reviewgate.infrastructure.kantata;

import dev.reviewgate.config.KantataProperties;
import dev.reviewgate.domain.enums.ReviewStatus;
import org.springframework.stereotype.Component;

/**
 * Internal status → Kantata custom field value. Kantata only distinguishes approved from
 * not-yet-approved, so every other status collapses to the in-progress value.
 */
@Component
public class StatusVocabulary {

    private final KantataProperties properties;

    public StatusVocabulary(KantataProperties properties) {
        this.properties = properties;
    }

    public String toExternal(ReviewStatus status) {
        return switch (status) {
            case APPROVED -> properties.approvedValue();
            case DRAFT, SUBMITTED, IN_REVIEW, NEEDS_WORK, ARCHIVED -> properties.inProgressValue();
        };
    }
}
