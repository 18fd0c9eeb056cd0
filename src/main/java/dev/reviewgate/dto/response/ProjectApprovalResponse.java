package dev.reviewgate.dto.response;

import dev.reviewgate.domain.enums.ReviewStatus;

import java.util.UUID;

/** Answer to "may this Kantata project go Live?" for the external side. */
public record ProjectApprovalResponse(String projectId, UUID reviewId, ReviewStatus reviewStatus,
                                      boolean approved, String message, String reviewUrl) {}
