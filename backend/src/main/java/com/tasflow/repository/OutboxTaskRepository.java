package com.tasflow.repository;

import com.tasflow.model.enums.OutboxTaskStatus;
import com.tasflow.model.enums.OutboxTaskType;
import com.tasflow.model.outbox.OutboxTask;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for outbox tasks.
 */
@Repository
public interface OutboxTaskRepository extends JpaRepository<OutboxTask, Long> {

    @Query("SELECT t.id FROM OutboxTask t WHERE t.status = :status ORDER BY t.id")
    List<Long> findIdsByStatus(@Param("status") OutboxTaskStatus status, Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE OutboxTask t SET t.status = :target, t.claimedAt = :now
        WHERE t.id = :id AND t.status = :required
        """)
    int transitionStatus(@Param("id") Long id,
                         @Param("required") OutboxTaskStatus required,
                         @Param("target") OutboxTaskStatus target,
                         @Param("now") Instant now);

    /**
     * Take a pending task for processing. Zero rows means another worker got it first.
     */
    default boolean claim(Long id, Instant now) {
        return transitionStatus(id, OutboxTaskStatus.PENDING, OutboxTaskStatus.IN_PROGRESS, now) == 1;
    }

    /**
     * Put tasks whose claim expired back to pending, counting the lost run as an attempt.
     * Only tasks that still have attempts left are touched.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE OutboxTask t
        SET t.status = com.tasflow.model.enums.OutboxTaskStatus.PENDING,
            t.attempts = t.attempts + 1, t.lastError = :reason, t.claimedAt = null
        WHERE t.status = com.tasflow.model.enums.OutboxTaskStatus.IN_PROGRESS
          AND t.claimedAt < :cutoff AND t.attempts + 1 < :maxAttempts
        """)
    int releaseExpiredClaims(@Param("cutoff") Instant cutoff,
                             @Param("maxAttempts") int maxAttempts,
                             @Param("reason") String reason);

    /**
     * Fail tasks whose claim expired on their last attempt.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE OutboxTask t
        SET t.status = com.tasflow.model.enums.OutboxTaskStatus.FAILED,
            t.attempts = t.attempts + 1, t.lastError = :reason, t.processedAt = :now
        WHERE t.status = com.tasflow.model.enums.OutboxTaskStatus.IN_PROGRESS
          AND t.claimedAt < :cutoff AND t.attempts + 1 >= :maxAttempts
        """)
    int failExpiredClaims(@Param("cutoff") Instant cutoff,
                          @Param("maxAttempts") int maxAttempts,
                          @Param("reason") String reason,
                          @Param("now") Instant now);

    List<OutboxTask> findByTypeOrderByIdAsc(OutboxTaskType type);
}
