package dev.reviewgate.workflow;

import dev.reviewgate.domain.entity.SlaRule;
import dev.reviewgate.domain.enums.ReviewStatus;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

/**
 * Deadline lookup against the configured SLA rules. A missing rule means the step is not tracked.
 */
@Component
public class SlaCalculator {

    public Optional<Instant> computeDeadline(ReviewStatus from, ReviewStatus to, Instant start,
                                             Collection<SlaRule> rules) {
        if (from == null || to == null || start == null || rules == null) {
            return Optional.empty();
        }
        return rules.stream()
                .filter(rule -> rule.matches(from, to))
                .findFirst()
                .map(rule -> start.plus(Duration.ofHours(rule.getDurationHours())));
    }
}
