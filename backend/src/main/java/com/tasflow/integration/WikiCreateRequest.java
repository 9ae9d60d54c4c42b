package com.tasflow.integration;

/**
 * New revision of a wiki page.
 */
public record WikiCreateRequest(
    String pageName,
    String markup,
    Long authorId,
    String revisionMessage,
    boolean minorEdit
) {

    public WikiCreateRequest(String pageName, String markup, Long authorId, String revisionMessage) {
        this(pageName, markup, authorId, revisionMessage, false);
    }
}
