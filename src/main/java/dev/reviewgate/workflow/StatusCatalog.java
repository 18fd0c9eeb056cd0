package dev.reviewgate.workflow;

import dev.reviewgate.domain.enums.ReviewStatus;
import dev.reviewgate.domain.enums.RoleRequirement;
import dev.reviewgate.domain.valueobject.Actor;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static dev.reviewgate.domain.enums.ReviewStatus.*;
import static dev.reviewgate.domain.enums.RoleRequirement.*;

/**
 * The complete table of legal status transitions and who may perform them.
 *
 * <pre>
 *   Draft      → Submitted (owner/admin), Archived (admin)
 *   Submitted  → Draft (owner/admin), In Review (admin), Archived (admin)
 *   In Review  → Needs Work (admin), Approved (admin), Archived (admin)
 *   Needs Work → Submitted (owner/admin), Draft (owner), Approved (admin), Archived (admin)
 *   Approved   → In Review (admin, re-open), Archived (admin)
 *   Archived   → (none)
 * </pre>
 *
 * Self-transitions are not in the table; the guard treats them as no-ops.
 */
@Component
public class StatusCatalog {

    private static final Map<ReviewStatus, Map<ReviewStatus, RoleRequirement>> TRANSITIONS;

    /** Step each status is expected to be followed by, used to pick the SLA rule on entry. */
    private static final Map<ReviewStatus, ReviewStatus> EXPECTED_NEXT;

    static {
        Map<ReviewStatus, Map<ReviewStatus, RoleRequirement>> t = new EnumMap<>(ReviewStatus.class);
        t.put(DRAFT, edges(SUBMITTED, OWNER_OR_ADMIN, ARCHIVED, ADMIN_ONLY));
        t.put(SUBMITTED, edges(DRAFT, OWNER_OR_ADMIN, IN_REVIEW, ADMIN_ONLY, ARCHIVED, ADMIN_ONLY));
        t.put(IN_REVIEW, edges(NEEDS_WORK, ADMIN_ONLY, APPROVED, ADMIN_ONLY, ARCHIVED, ADMIN_ONLY));
        t.put(NEEDS_WORK, edges(SUBMITTED, OWNER_OR_ADMIN, DRAFT, OWNER, APPROVED, ADMIN_ONLY, ARCHIVED, ADMIN_ONLY));
        t.put(APPROVED, edges(IN_REVIEW, ADMIN_ONLY, ARCHIVED, ADMIN_ONLY));
        t.put(ARCHIVED, new EnumMap<>(ReviewStatus.class));
        TRANSITIONS = Collections.unmodifiableMap(t);

        Map<ReviewStatus, ReviewStatus> next = new EnumMap<>(ReviewStatus.class);
        next.put(SUBMITTED, IN_REVIEW);
        next.put(IN_REVIEW, APPROVED);
        next.put(NEEDS_WORK, SUBMITTED);
        EXPECTED_NEXT = Collections.unmodifiableMap(next);
    }

    /**
     * @return the role requirement for {@code from → to}, or empty when the move is not in the table
     */
    public Optional<RoleRequirement> isLegalTransition(ReviewStatus from, ReviewStatus to) {
        if (from == null || to == null) {
            throw new NullPointerException("from and to must not be null");
        }
        return Optional.ofNullable(TRANSITIONS.get(from).get(to));
    }

    public Optional<ReviewStatus> expectedNext(ReviewStatus status) {
        return Optional.ofNullable(EXPECTED_NEXT.get(status));
    }

    /**
     * Statuses {@code actor} could move a review owned by {@code ownerId} to from {@code from},
     * ignoring entity preconditions such as required fields.
     */
    public List<ReviewStatus> availableTargets(ReviewStatus from, Actor actor, String ownerId) {
        return TRANSITIONS.get(from).entrySet().stream()
                .filter(e -> e.getValue().isSatisfiedBy(actor, ownerId))
                .map(Map.Entry::getKey)
                .toList();
    }

    private static Map<ReviewStatus, RoleRequirement> edges(Object... pairs) {
        Map<ReviewStatus, RoleRequirement> m = new EnumMap<>(ReviewStatus.class);
        for (int i = 0; i < pairs.length; i += 2) {
            m.put((ReviewStatus) pairs[i], (RoleRequirement) pairs[i + 1]);
        }
        return m;
    }
}
