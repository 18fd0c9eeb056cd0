package dev.reviewgate.repository;

import dev.reviewgate.domain.entity.StatusHistoryEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface StatusHistoryRepository extends JpaRepository<StatusHistoryEntry, UUID> {
    List<StatusHistoryEntry> findByReviewIdOrderByChangedAtAsc(UUID reviewId);
}
