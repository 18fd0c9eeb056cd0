package dev.reviewgate.service;

import dev.reviewgate.domain.entity.Review;
import dev.reviewgate.dto.response.ReconciliationResponse;
import dev.reviewgate.reconciliation.ReconciliationJob;
import dev.reviewgate.reconciliation.ReconciliationOutcome;
import dev.reviewgate.reconciliation.ReconciliationResult;
import dev.reviewgate.repository.ReviewRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Loads every linked review and runs one reconciliation sweep over it. Safe to run concurrently with
 * itself and with status changes: each correction is an idempotent write to Kantata.
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final ReviewRepository reviewRepository;
    private final ReconciliationJob job;
    private final Clock clock;

    public ReconciliationService(ReviewRepository reviewRepository, ReconciliationJob job, Clock clock) {
        this.reviewRepository = reviewRepository;
        this.job = job;
        this.clock = clock;
    }

    public ReconciliationResponse runSweep() {
        List<Review> linked = reviewRepository.findByExternalProjectIdIsNotNull();
        log.info("Starting reconciliation of {} linked reviews", linked.size());
        List<ReconciliationResult> results = job.reconcileAll(linked);

        long corrected = results.stream().filter(r -> r.outcome() == ReconciliationOutcome.CORRECTED).count();
        long invalid = results.stream().filter(r -> !r.valid()).count();
        return new ReconciliationResponse(results.size(), corrected, invalid, results, clock.instant());
    }
}
