package dev.reviewgate.dto.response;

import dev.reviewgate.reconciliation.ReconciliationResult;

import java.time.Instant;
import java.util.List;

public record ReconciliationResponse(int checkedCount, long correctedCount, long invalidCount,
                                     List<ReconciliationResult> results, Instant completedAt) {}
