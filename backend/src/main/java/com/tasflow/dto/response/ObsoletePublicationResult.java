package com.tasflow.dto.response;

import java.util.List;

/**
 * What the publisher pre-fills from a publication that is about to be obsoleted.
 */
public record ObsoletePublicationResult(
    String title,
    List<Long> tagIds,
    String markup
) {}
