package com.tasflow.dto.response;

import com.tasflow.model.enums.FailureKind;

/**
 * Outcome of publishing a submission. {@code errorMessage} is null on success and carries
 * diagnostic detail when the publish transaction was rolled back.
 */
public record PublishSubmissionResult(
    String errorMessage,
    FailureKind failureKind,
    Long publicationId,
    String publicationTitle
) {

    public boolean isSuccess() {
        return errorMessage == null;
    }

    public static PublishSubmissionResult successful(Long publicationId, String publicationTitle) {
        return new PublishSubmissionResult(null, null, publicationId, publicationTitle);
    }

    public static PublishSubmissionResult failed(FailureKind kind, String message) {
        return new PublishSubmissionResult(message, kind, null, null);
    }
}
