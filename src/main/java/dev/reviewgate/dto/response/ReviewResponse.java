package dev.reviewgate.dto.response;

import dev.reviewgate.domain.enums.ReviewStatus;
import dev.reviewgate.domain.enums.SyncState;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ReviewResponse(
        UUID id, String title, String description, String graphName, String accountName,
        ReviewStatus status, String ownerId, String leadId, String externalProjectId,
        Instant slaDeadline, boolean slaBreached, SyncState syncState, String syncError,
        List<ReviewStatus> availableTransitions, List<HistoryEntryResponse> history,
        Instant createdAt, Instant updatedAt
) {}
