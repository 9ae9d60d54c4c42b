package com.tasflow.dto.response;

import com.tasflow.model.enums.FailureKind;
import com.tasflow.model.enums.SubmissionStatus;

/**
 * Outcome of updating a submission. {@code errorMessage} is null on success.
 *
 * @param previousStatus status before the update, for callers that announce status changes
 */
public record UpdateSubmissionResult(
    String errorMessage,
    FailureKind failureKind,
    SubmissionStatus previousStatus,
    String submissionTitle
) {

    public boolean isSuccess() {
        return errorMessage == null;
    }

    public static UpdateSubmissionResult successful(SubmissionStatus previousStatus, String submissionTitle) {
        return new UpdateSubmissionResult(null, null, previousStatus, submissionTitle);
    }

    public static UpdateSubmissionResult error(FailureKind kind, String message) {
        return new UpdateSubmissionResult(message, kind, null, null);
    }
}
