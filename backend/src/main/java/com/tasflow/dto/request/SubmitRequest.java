package com.tasflow.dto.request;

import com.tasflow.ingest.UploadedMovie;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;

import java.util.List;

/**
 * Request DTO for a new submission.
 *
 * @param authors user names of the registered authors, in credit order
 * @param externalAuthors comma separated names of authors without an account
 */
@Builder
public record SubmitRequest(
    @NotNull Long submitterId,
    @NotNull UploadedMovie movieFile,

    // Game information as the submitter knows it
    @NotBlank @Size(max = 100) String gameName,
    @Size(max = 100) String gameVersion,
    @Size(max = 50) String goal,
    @Size(max = 255) String romName,
    @Size(max = 255) String emulator,
    @Size(max = 500) String encodeEmbedLink,

    @NotEmpty List<@NotBlank String> authors,
    @Size(max = 500) String externalAuthors,

    @NotBlank String markup
) {}
