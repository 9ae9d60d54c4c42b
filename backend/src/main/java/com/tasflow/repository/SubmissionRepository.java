package com.tasflow.repository;

import com.tasflow.model.enums.SubmissionStatus;
import com.tasflow.model.submission.Submission;
import com.tasflow.model.user.User;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for submissions.
 *
 * Status writes are conditional on both the expected status and the version token read by the
 * caller, so a concurrent writer that committed first makes the update affect zero rows.
 */
@Repository
public interface SubmissionRepository extends JpaRepository<Submission, Long> {

    /**
     * Find submission with everything needed to update or publish it.
     */
    @EntityGraph(attributePaths = {
        "authors", "authors.author", "submitter", "judge", "publisher",
        "system", "systemFrameRate", "game", "gameVersion", "gameGoal", "intendedClass"
    })
    @Query("SELECT s FROM Submission s WHERE s.id = :id")
    Optional<Submission> findByIdWithDetails(@Param("id") Long id);

    /**
     * Move a submission to judging and assign the judge.
     *
     * @return number of rows changed, 0 when the status or version no longer match
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE Submission s
        SET s.status = :target, s.judge = :judge, s.version = s.version + 1, s.updatedAt = :now
        WHERE s.id = :id AND s.status = :required AND s.version = :version
        """)
    int claimForJudging(@Param("id") Long id,
                        @Param("version") Long version,
                        @Param("required") SubmissionStatus required,
                        @Param("target") SubmissionStatus target,
                        @Param("judge") User judge,
                        @Param("now") Instant now);

    /**
     * Move a submission to publication and assign the publisher.
     *
     * @return number of rows changed, 0 when the status or version no longer match
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE Submission s
        SET s.status = :target, s.publisher = :publisher, s.version = s.version + 1, s.updatedAt = :now
        WHERE s.id = :id AND s.status = :required AND s.version = :version
        """)
    int claimForPublishing(@Param("id") Long id,
                           @Param("version") Long version,
                           @Param("required") SubmissionStatus required,
                           @Param("target") SubmissionStatus target,
                           @Param("publisher") User publisher,
                           @Param("now") Instant now);

    /**
     * Change only the status, conditional on the expected status and version.
     */
    @Modifying(flushAutomatically = true)
    @Query("""
        UPDATE Submission s
        SET s.status = :target, s.version = s.version + 1, s.updatedAt = :now
        WHERE s.id = :id AND s.status = :required AND s.version = :version
        """)
    int transitionStatus(@Param("id") Long id,
                         @Param("version") Long version,
                         @Param("required") SubmissionStatus required,
                         @Param("target") SubmissionStatus target,
                         @Param("now") Instant now);

    @Query("SELECT s.status FROM Submission s WHERE s.id = :id")
    Optional<SubmissionStatus> findStatusById(@Param("id") Long id);

    long countBySubmitterId(Long submitterId);
}
