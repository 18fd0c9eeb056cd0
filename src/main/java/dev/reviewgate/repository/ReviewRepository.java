package dev.reviewgate.repository;

import dev.reviewgate.domain.entity.Review;
import dev.reviewgate.domain.enums.SyncState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ReviewRepository extends JpaRepository<Review, UUID> {
    Optional<Review> findByExternalProjectId(String externalProjectId);
    List<Review> findByExternalProjectIdIsNotNull();

    /**
     * Targeted update so a sync result never overwrites a concurrent status change with a stale entity.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update Review r set r.syncState = :state, r.syncError = :error, r.syncedAt = :at where r.id = :id")
    int updateSyncState(@Param("id") UUID id, @Param("state") SyncState state,
                        @Param("error") String error, @Param("at") Instant at);
}
