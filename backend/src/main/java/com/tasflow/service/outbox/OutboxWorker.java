package com.tasflow.service.outbox;

import com.tasflow.helper.ConcurrencyHelper;
import com.tasflow.integration.AutomationAgent;
import com.tasflow.integration.RoleGrantor;
import com.tasflow.integration.VideoDescriptor;
import com.tasflow.integration.VideoSync;
import com.tasflow.model.enums.OutboxTaskStatus;
import com.tasflow.model.outbox.OutboxTask;
import com.tasflow.repository.OutboxTaskRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Delivers outbox tasks to their collaborators.
 *
 * Each task is claimed, dispatched and settled on its own. A failed task goes back to pending
 * with its error recorded until it runs out of attempts, and never holds up the tasks after it.
 * A task left IN_PROGRESS by a worker that died is taken back once its claim is older than the lease.
 */
@Service
@Slf4j
public class OutboxWorker {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final OutboxTaskRepository taskRepository;
    private final OutboxService outboxService;
    private final VideoSync videoSync;
    private final RoleGrantor roleGrantor;
    private final AutomationAgent automationAgent;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final int batchSize;
    private final int maxAttempts;
    private final Duration lease;

    public OutboxWorker(
            OutboxTaskRepository taskRepository,
            OutboxService outboxService,
            VideoSync videoSync,
            RoleGrantor roleGrantor,
            AutomationAgent automationAgent,
            TransactionTemplate transactionTemplate,
            Clock clock,
            @Value("${tasflow.outbox.batch-size:50}") int batchSize,
            @Value("${tasflow.outbox.max-attempts:5}") int maxAttempts,
            @Value("${tasflow.outbox.lease-ms:300000}") long leaseMillis) {
        this.taskRepository = taskRepository;
        this.outboxService = outboxService;
        this.videoSync = videoSync;
        this.roleGrantor = roleGrantor;
        this.automationAgent = automationAgent;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.batchSize = batchSize;
        this.maxAttempts = maxAttempts;
        this.lease = Duration.ofMillis(leaseMillis);
    }

    @Scheduled(fixedDelayString = "${tasflow.outbox.poll-interval-ms:5000}")
    public void poll() {
        int delivered = drainPending();
        if (delivered > 0) {
            log.debug("Delivered {} outbox tasks", delivered);
        }
    }

    /**
     * Process one batch of pending tasks.
     *
     * @return number of tasks delivered successfully
     */
    public int drainPending() {
        reclaimExpired();
        List<Long> ids = taskRepository.findIdsByStatus(OutboxTaskStatus.PENDING, PageRequest.of(0, batchSize));
        int delivered = 0;
        for (Long id : ids) {
            if (process(id)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Take back tasks whose worker never settled them.
     */
    void reclaimExpired() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(lease);
        String reason = "Claim expired after " + lease.toMillis() + " ms without a result";
        int[] counts = ConcurrencyHelper.executeWithRetry(() -> transactionTemplate.execute(status -> new int[] {
            taskRepository.releaseExpiredClaims(cutoff, maxAttempts, reason),
            taskRepository.failExpiredClaims(cutoff, maxAttempts, reason, now)
        }), new int[] {0, 0});
        if (counts[0] > 0 || counts[1] > 0) {
            log.warn("Reclaimed {} expired outbox tasks, {} of them out of attempts", counts[0] + counts[1], counts[1]);
        }
    }

    private boolean process(Long taskId) {
        boolean claimed = ConcurrencyHelper.executeWithRetry(
            () -> transactionTemplate.execute(status -> taskRepository.claim(taskId, clock.instant())), Boolean.FALSE);
        if (!claimed) {
            return false;
        }

        Optional<OutboxTask> task = transactionTemplate.execute(status -> taskRepository.findById(taskId));
        if (task.isEmpty()) {
            return false;
        }

        try {
            dispatch(task.get());
        } catch (RuntimeException e) {
            log.warn("Outbox task {} ({}) failed on attempt {}",
                taskId, task.get().getType(), task.get().getAttempts() + 1, e);
            settle(taskId, e);
            return false;
        }

        settle(taskId, null);
        return true;
    }

    private void dispatch(OutboxTask task) {
        switch (task.getType()) {
            case VIDEO_SYNC -> videoSync.sync(outboxService.fromJson(task, VideoDescriptor.class));
            case GRANT_PUBLICATION_ROLES -> {
                RoleGrantPayload payload = outboxService.fromJson(task, RoleGrantPayload.class);
                roleGrantor.assignAutoAssignableRolesByPublication(payload.authorIds(), payload.publicationTitle());
            }
            case NOTIFY_PUBLISHED -> {
                PublishedNoticePayload payload = outboxService.fromJson(task, PublishedNoticePayload.class);
                automationAgent.postSubmissionPublished(payload.submissionId(), payload.publicationId());
            }
        }
    }

    /**
     * Mark a task done, or record the failure and decide whether it gets another attempt.
     */
    private void settle(Long taskId, RuntimeException failure) {
        boolean recorded = ConcurrencyHelper.executeWithRetry(() -> transactionTemplate.executeWithoutResult(status -> {
            OutboxTask task = taskRepository.findById(taskId)
                .orElseThrow(() -> new IllegalStateException("Outbox task " + taskId + " disappeared"));
            task.setAttempts(task.getAttempts() + 1);
            if (failure == null) {
                task.setStatus(OutboxTaskStatus.DONE);
                task.setLastError(null);
                task.setProcessedAt(clock.instant());
                return;
            }
            task.setLastError(truncate(failure.toString()));
            if (task.getAttempts() >= maxAttempts) {
                task.setStatus(OutboxTaskStatus.FAILED);
                task.setProcessedAt(clock.instant());
                log.error("Outbox task {} ({}) failed permanently after {} attempts",
                    taskId, task.getType(), task.getAttempts());
            } else {
                task.setStatus(OutboxTaskStatus.PENDING);
            }
        }));
        if (!recorded) {
            log.warn("Could not record outcome of outbox task {}, it is retried once its claim expires", taskId);
        }
    }

    private static String truncate(String message) {
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
