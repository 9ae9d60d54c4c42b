package com.tasflow.dto.response;

import com.tasflow.model.enums.FailureKind;

/**
 * Outcome of a claim. {@code errorMessage} is null on success.
 */
public record ClaimSubmissionResult(
    String errorMessage,
    FailureKind failureKind,
    String submissionTitle
) {

    public boolean isSuccess() {
        return errorMessage == null;
    }

    public static ClaimSubmissionResult successful(String submissionTitle) {
        return new ClaimSubmissionResult(null, null, submissionTitle);
    }

    public static ClaimSubmissionResult error(FailureKind kind, String message) {
        return new ClaimSubmissionResult(message, kind, null);
    }
}
