package dev.reviewgate.dto.request;

/**
 * One entry of the SLA rule set. Checked by {@code SlaRuleService}, which rejects the whole set on
 * the first bad entry.
 */
public record SlaRuleRequest(String fromStatus, String toStatus, int durationHours) {}
