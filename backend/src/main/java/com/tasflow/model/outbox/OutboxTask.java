package com.tasflow.model.outbox;

import com.tasflow.model.AuditableEntity;
import com.tasflow.model.enums.OutboxTaskStatus;
import com.tasflow.model.enums.OutboxTaskType;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

/**
 * Pending downstream side effect, written in the same transaction as the change that caused it.
 */
@Entity
@Table(name = "outbox_task", indexes = {
    @Index(name = "idx_outbox_task_status", columnList = "status, id")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxTask extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private OutboxTaskType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private OutboxTaskStatus status = OutboxTaskStatus.PENDING;

    /**
     * JSON payload, shape depends on {@link #type}.
     */
    @Column(columnDefinition = "TEXT", nullable = false)
    private String payload;

    @Column(nullable = false)
    @Builder.Default
    private int attempts = 0;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    /**
     * When a worker last took the task; an IN_PROGRESS task older than the lease is taken back.
     */
    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "processed_at")
    private Instant processedAt;
}
