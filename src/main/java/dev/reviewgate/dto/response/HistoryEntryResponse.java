package dev.reviewgate.dto.response;

import dev.reviewgate.domain.enums.ReviewStatus;

import java.time.Instant;

public record HistoryEntryResponse(ReviewStatus oldStatus, ReviewStatus newStatus, String actorId, Instant changedAt) {}
