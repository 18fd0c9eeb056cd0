package dev.reviewgate.reconciliation;

import dev.reviewgate.config.KantataProperties;
import dev.reviewgate.config.NotificationProperties;
import dev.reviewgate.domain.entity.Review;
import dev.reviewgate.domain.entity.UserProfile;
import dev.reviewgate.domain.enums.Role;
import dev.reviewgate.infrastructure.kantata.KantataProjectStatus;
import dev.reviewgate.infrastructure.notification.Notifier;
import dev.reviewgate.repository.UserProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Tells the review owner, the project lead and every administrator that a Kantata project was found
 * Live ahead of its review's approval. One message per drift, all recipients on it.
 */
@Component
public class DriftNotifier {

    private static final Logger log = LoggerFactory.getLogger(DriftNotifier.class);

    private final Notifier notifier;
    private final UserProfileRepository profileRepository;
    private final NotificationProperties notificationProperties;
    private final KantataProperties kantataProperties;

    public DriftNotifier(Notifier notifier, UserProfileRepository profileRepository,
                         NotificationProperties notificationProperties, KantataProperties kantataProperties) {
        this.notifier = notifier;
        this.profileRepository = profileRepository;
        this.notificationProperties = notificationProperties;
        this.kantataProperties = kantataProperties;
    }

    /**
     * @return true if the message was handed to the notifier; never throws
     */
    public boolean notifyDrift(Review review, KantataProjectStatus external, boolean reverted) {
        try {
            Set<String> recipients = recipientsFor(review);
            String subject = "Review Status Alert: Kantata project %s was Live before approval"
                    .formatted(review.getExternalProjectId());
            return notifier.send(recipients, subject, body(review, external, reverted));
        } catch (RuntimeException e) {
            log.error("Could not notify about drift on review {}: {}", review.getId(), e.getMessage(), e);
            return false;
        }
    }

    Set<String> recipientsFor(Review review) {
        List<String> ids = new ArrayList<>();
        ids.add(review.getOwnerId());
        if (review.getLeadId() != null) ids.add(review.getLeadId());

        Set<String> emails = new LinkedHashSet<>();
        profileRepository.findByIdIn(ids).stream().map(UserProfile::getEmail).forEach(emails::add);
        profileRepository.findByRole(Role.ADMIN).stream().map(UserProfile::getEmail).forEach(emails::add);
        return emails;
    }

    private String body(Review review, KantataProjectStatus external, boolean reverted) {
        String action = reverted
                ? "The Kantata project has been reset to In Development."
                : "Resetting the Kantata project failed; please change its status manually.";
        return """
                Kantata project %s ("%s") was marked "%s" while its review "%s" is "%s".
                Projects must not go Live until the linked review is Approved.

                %s

                Review:  %s
                Project: %s
                Review id: %s
                """.formatted(
                review.getExternalProjectId(),
                external.title() == null ? review.getExternalProjectId() : external.title(),
                external.statusMessage(),
                review.getTitle(),
                review.getStatus(),
                action,
                notificationProperties.reviewUrl(review.getId()),
                kantataProperties.workspaceUrl(review.getExternalProjectId()),
                review.getId());
    }
}
