package com.tasflow.dto.response;

import com.tasflow.model.enums.FailureKind;

/**
 * Outcome of creating a submission. {@code errorMessage} is null on success.
 */
public record SubmitResult(
    String errorMessage,
    FailureKind failureKind,
    Long submissionId,
    String submissionTitle
) {

    public boolean isSuccess() {
        return errorMessage == null;
    }

    public static SubmitResult successful(Long submissionId, String submissionTitle) {
        return new SubmitResult(null, null, submissionId, submissionTitle);
    }

    public static SubmitResult failed(FailureKind kind, String message) {
        return new SubmitResult(message, kind, null, null);
    }
}
