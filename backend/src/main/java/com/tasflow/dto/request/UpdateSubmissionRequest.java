package com.tasflow.dto.request;

import com.tasflow.ingest.UploadedMovie;
import com.tasflow.model.enums.PermissionTo;
import com.tasflow.model.enums.SubmissionStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;

import java.util.List;
import java.util.Set;

/**
 * Request DTO for editing a submission.
 * Catalog fields are only applied when {@code gameId} is present; authors only when the list is present.
 *
 * @param version write token the caller loaded the submission with, null to skip the check
 * @param permissions permission facts of the acting user
 */
@Builder
public record UpdateSubmissionRequest(
    @NotNull Long submissionId,
    Long version,

    // Acting user
    @NotNull Long userId,
    @NotBlank String userName,
    @NotNull Set<PermissionTo> permissions,

    @NotNull SubmissionStatus status,
    Long rejectionReasonId,
    Long intendedClassId,

    // Catalog assignment
    Long gameId,
    Long gameVersionId,
    Long gameGoalId,

    // Submitter supplied information
    @NotBlank @Size(max = 100) String gameName,
    @Size(max = 100) String gameVersion,
    @Size(max = 50) String goal,
    @Size(max = 255) String romName,
    @Size(max = 255) String emulator,
    @Size(max = 500) String encodeEmbedLink,
    List<@NotBlank String> authors,
    @Size(max = 500) String externalAuthors,

    UploadedMovie replaceMovieFile,

    // Description revision
    boolean markupChanged,
    String markup,
    boolean minorEdit,
    @Size(max = 500) String revisionMessage
) {
}
