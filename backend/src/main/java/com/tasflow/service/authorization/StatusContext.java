package com.tasflow.service.authorization;

import com.tasflow.model.enums.PermissionTo;
import com.tasflow.model.enums.SubmissionStatus;

import java.util.Set;

/**
 * Facts about a submission and the acting user that status guards decide on.
 *
 * @param judgingWindowOpen whether the minimum time before judgment has elapsed
 */
public record StatusContext(
    SubmissionStatus currentStatus,
    Set<PermissionTo> permissions,
    boolean judgingWindowOpen,
    boolean authorOrSubmitter,
    boolean judge,
    boolean publisher
) {

    public boolean canJudge() {
        return permissions.contains(PermissionTo.JUDGE_SUBMISSIONS);
    }

    public boolean canPublish() {
        return permissions.contains(PermissionTo.PUBLISH_MOVIES);
    }

    public boolean canOverride() {
        return permissions.contains(PermissionTo.OVERRIDE_SUBMISSION_CONSTRAINTS);
    }

    public boolean isIn(Set<SubmissionStatus> statuses) {
        return statuses.contains(currentStatus);
    }

    /**
     * Claiming judge acting after the judging window opened.
     */
    public boolean judgeAfterWindow() {
        return judge && judgingWindowOpen;
    }
}
