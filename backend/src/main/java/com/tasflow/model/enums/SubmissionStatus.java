package com.tasflow.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a submission.
 */
public enum SubmissionStatus {
    NEW("new"),
    DELAYED("delayed"),
    NEEDS_MORE_INFO("needs_more_info"),
    JUDGING_UNDERWAY("judging_underway"),
    ACCEPTED("accepted"),
    PUBLICATION_UNDERWAY("publication_underway"),
    PUBLISHED("published"),
    REJECTED("rejected"),
    CANCELLED("cancelled"),
    PLAYGROUND("playground");

    private static final Set<SubmissionStatus> JUDGEABLE =
        EnumSet.of(NEW, DELAYED, NEEDS_MORE_INFO, JUDGING_UNDERWAY);

    private static final Set<SubmissionStatus> WORK_IN_PROGRESS =
        EnumSet.of(NEW, DELAYED, NEEDS_MORE_INFO, JUDGING_UNDERWAY, ACCEPTED, PUBLICATION_UNDERWAY);

    private final String value;

    SubmissionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Whether the judging window still applies to a submission in this status.
     */
    public boolean canBeJudged() {
        return JUDGEABLE.contains(this);
    }

    /**
     * Statuses in which the submission is still moving through review or publication.
     */
    public boolean isWorkInProgress() {
        return WORK_IN_PROGRESS.contains(this);
    }

    /**
     * Rejected or cancelled; the discussion topic leaves the workbench for the discard forum.
     */
    public boolean isDiscarded() {
        return this == REJECTED || this == CANCELLED;
    }

    public static SubmissionStatus fromValue(String value) {
        if (value == null) {
            return NEW;
        }
        for (SubmissionStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown SubmissionStatus: " + value);
    }
}
