package com.tasflow.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;

import java.util.Set;

/**
 * Request DTO for publishing a submission that is under publication.
 *
 * @param movieFilename stored file name without the extension
 * @param movieToObsolete publication the new one supersedes, if any
 */
@Builder
public record PublishSubmissionRequest(
    @NotNull Long submissionId,
    @NotNull Long userId,

    @NotBlank @Pattern(regexp = "[A-Za-z0-9._-]+") String movieFilename,
    @NotBlank String movieExtension,

    // Video links
    @NotBlank String onlineWatchingUrl,
    String alternateOnlineWatchingUrl,
    String alternateOnlineWatchUrlName,
    String mirrorSiteUrl,

    Set<Long> selectedFlags,
    Set<Long> selectedTags,

    @NotBlank String movieDescription,
    Long movieToObsolete
) {

    public String movieFileNameWithExtension() {
        String extension = movieExtension.startsWith(".") ? movieExtension.substring(1) : movieExtension;
        return movieFilename + "." + extension;
    }
}
