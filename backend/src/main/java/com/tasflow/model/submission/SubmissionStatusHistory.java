package com.tasflow.model.submission;

import com.tasflow.model.AuditableEntity;
import com.tasflow.model.enums.SubmissionStatus;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;
import org.hibernate.annotations.Immutable;

/**
 * Append-only audit record of a status change. Rows are never updated or deleted.
 */
@Entity
@Immutable
@Table(name = "submission_status_history", indexes = {
    @Index(name = "idx_status_history_submission", columnList = "submission_id")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionStatusHistory extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "submission_id", nullable = false, updatable = false)
    private Long submissionId;

    /**
     * Status held before the change.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "prior_status", nullable = false, updatable = false, length = 50)
    private SubmissionStatus priorStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status", nullable = false, updatable = false, length = 50)
    private SubmissionStatus newStatus;
}
