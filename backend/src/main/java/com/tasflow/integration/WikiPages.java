package com.tasflow.integration;

import com.tasflow.model.wiki.WikiPage;

import java.util.Optional;

/**
 * Revisioned wiki storage used for submission and publication descriptions.
 */
public interface WikiPages {

    /**
     * Add a revision, making it the current one for its page.
     */
    WikiPage add(WikiCreateRequest request);

    /**
     * Current revision of a page.
     */
    Optional<WikiPage> page(String pageName);
}
