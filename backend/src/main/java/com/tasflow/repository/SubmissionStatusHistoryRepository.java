package com.tasflow.repository;

import com.tasflow.model.enums.SubmissionStatus;
import com.tasflow.model.submission.SubmissionStatusHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for the append-only status history.
 */
@Repository
public interface SubmissionStatusHistoryRepository extends JpaRepository<SubmissionStatusHistory, Long> {

    List<SubmissionStatusHistory> findBySubmissionIdOrderByIdAsc(Long submissionId);

    long countBySubmissionId(Long submissionId);

    /**
     * Append a history record for a status change.
     */
    default SubmissionStatusHistory append(Long submissionId, SubmissionStatus prior,
                                           SubmissionStatus next, Instant at) {
        return save(SubmissionStatusHistory.builder()
            .submissionId(submissionId)
            .priorStatus(prior)
            .newStatus(next)
            .createdAt(at)
            .build());
    }
}
