package com.tasflow.service.authorization;

import com.tasflow.model.enums.PermissionTo;
import com.tasflow.model.enums.SubmissionStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Decides which statuses an actor may move a submission to.
 */
@Service
public class SubmissionAuthorizationService {

    private final Clock clock;
    private final int minimumHoursBeforeJudgment;
    private final List<StatusGuard> guards;

    public SubmissionAuthorizationService(
            Clock clock,
            @Value("${tasflow.submission.minimum-hours-before-judgment:72}") int minimumHoursBeforeJudgment) {
        this.clock = clock;
        this.minimumHoursBeforeJudgment = minimumHoursBeforeJudgment;
        this.guards = List.of(StatusGuards.values());
    }

    /**
     * Statuses the actor may set, current status included.
     * Published is never offered; it is only reachable through the publish operation.
     */
    public Set<SubmissionStatus> availableStatuses(
            SubmissionStatus currentStatus,
            Set<PermissionTo> permissions,
            Instant submitDate,
            boolean isAuthorOrSubmitter,
            boolean isJudge,
            boolean isPublisher) {

        if (currentStatus == SubmissionStatus.PUBLISHED) {
            return Collections.unmodifiableSet(EnumSet.of(SubmissionStatus.PUBLISHED));
        }

        if (permissions.contains(PermissionTo.OVERRIDE_SUBMISSION_CONSTRAINTS)) {
            return Collections.unmodifiableSet(EnumSet.complementOf(EnumSet.of(SubmissionStatus.PUBLISHED)));
        }

        StatusContext context = new StatusContext(
            currentStatus,
            permissions,
            isJudgingWindowOpen(submitDate),
            isAuthorOrSubmitter,
            isJudge,
            isPublisher);

        EnumSet<SubmissionStatus> available = EnumSet.noneOf(SubmissionStatus.class);
        for (StatusGuard guard : guards) {
            available.addAll(guard.offer(context));
        }
        return Collections.unmodifiableSet(available);
    }

    /**
     * Whole hours left before a verdict may be given, 0 once the status is past judging.
     */
    public int hoursRemainingForJudging(SubmissionStatus status, Instant submitDate) {
        if (!status.canBeJudged()) {
            return 0;
        }
        double hoursSince = Duration.between(submitDate, clock.instant()).toMinutes() / 60.0;
        return Math.max(0, minimumHoursBeforeJudgment - (int) hoursSince);
    }

    public boolean isJudgingWindowOpen(Instant submitDate) {
        return !clock.instant().isBefore(submitDate.plus(Duration.ofHours(minimumHoursBeforeJudgment)));
    }
}
