package dev.reviewgate.domain.entity;

import dev.reviewgate.domain.enums.ReviewStatus;
import jakarta.persistence.*;

import java.util.UUID;

/**
 * Administrator-managed deadline rule. At most one rule per (from, to) pair.
 */
@Entity
@Table(name = "sla_rules", uniqueConstraints = {
        @UniqueConstraint(name = "uq_sla_rules_pair", columnNames = {"from_status", "to_status"})
})
public class SlaRule {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "from_status", nullable = false, length = 20)
    private ReviewStatus fromStatus;

    @Column(name = "to_status", nullable = false, length = 20)
    private ReviewStatus toStatus;

    @Column(name = "duration_hours", nullable = false)
    private int durationHours;

    protected SlaRule() {
    }

    public static SlaRule of(ReviewStatus from, ReviewStatus to, int durationHours) {
        if (from == null || to == null) throw new IllegalArgumentException("from and to statuses required");
        if (durationHours <= 0) throw new IllegalArgumentException("durationHours must be positive");
        SlaRule r = new SlaRule();
        r.id = UUID.randomUUID();
        r.fromStatus = from;
        r.toStatus = to;
        r.durationHours = durationHours;
        return r;
    }

    public boolean matches(ReviewStatus from, ReviewStatus to) {
        return fromStatus == from && toStatus == to;
    }

    public UUID getId() {
        return id;
    }

    public ReviewStatus getFromStatus() {
        return fromStatus;
    }

    public ReviewStatus getToStatus() {
        return toStatus;
    }

    public int getDurationHours() {
        return durationHours;
    }
}
