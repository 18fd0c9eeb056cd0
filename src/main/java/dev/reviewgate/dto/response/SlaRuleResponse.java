package dev.reviewgate.dto.response;

import dev.reviewgate.domain.enums.ReviewStatus;

public record SlaRuleResponse(ReviewStatus fromStatus, ReviewStatus toStatus, int durationHours) {}
