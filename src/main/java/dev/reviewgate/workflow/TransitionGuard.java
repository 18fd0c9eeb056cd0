package dev.reviewgate.workflow;

import dev.reviewgate.domain.entity.Review;
import dev.reviewgate.domain.enums.ReviewStatus;
import dev.reviewgate.domain.enums.RoleRequirement;
import dev.reviewgate.domain.valueobject.Actor;
import dev.reviewgate.domain.valueobject.Transition;
import dev.reviewgate.exception.IllegalTransitionException;
import dev.reviewgate.exception.IncompleteReviewException;
import dev.reviewgate.exception.TransitionForbiddenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Single authority on whether a status change may happen. Performs no writes.
 *
 * <p>Checks, in order: self-transition (no-op), catalog membership, role/ownership, required fields
 * when leaving DRAFT. The role check here is the authoritative one; storage-level access policies
 * do not know about individual transitions.
 */
@Component
public class TransitionGuard {

    private static final Logger log = LoggerFactory.getLogger(TransitionGuard.class);

    private final StatusCatalog catalog;
    private final Clock clock;

    public TransitionGuard(StatusCatalog catalog, Clock clock) {
        this.catalog = catalog;
        this.clock = clock;
    }

    public Transition attemptTransition(Review review, ReviewStatus requested, Actor actor) {
        ReviewStatus current = review.getStatus();

        if (requested == current) {
            return new Transition(review.getId(), current, requested, actor, clock.instant());
        }

        RoleRequirement requirement = catalog.isLegalTransition(current, requested)
                .orElseThrow(() -> new IllegalTransitionException(current, requested));

        if (!requirement.isSatisfiedBy(actor, review.getOwnerId())) {
            log.warn("Forbidden transition: actor={} role={} review={} {} -> {} requires {}",
                    actor.id(), actor.role(), review.getId(), current, requested, requirement);
            throw new TransitionForbiddenException(current, requested, requirement);
        }

        if (current == ReviewStatus.DRAFT) {
            List<String> missing = review.missingRequiredFields();
            if (!missing.isEmpty()) {
                throw new IncompleteReviewException(current, requested, missing);
            }
        }

        return new Transition(review.getId(), current, requested, actor, clock.instant());
    }
}
