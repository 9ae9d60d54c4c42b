package com.tasflow.integration;

import java.time.Instant;
import java.util.List;

/**
 * What a video host needs to refresh a publication's video listing.
 *
 * @param obsoletedBy publication superseding this one, null while current
 */
public record VideoDescriptor(
    Long publicationId,
    Instant publicationCreated,
    String url,
    String urlDisplayName,
    String title,
    String wikiMarkup,
    String systemCode,
    List<String> authors,
    Long obsoletedBy
) {
}
