package com.tasflow.integration;

import com.tasflow.model.wiki.WikiPage;
import com.tasflow.repository.WikiPageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Wiki storage backed by the application database.
 * Joins the caller's transaction so a revision rolls back with the change that wrote it.
 */
@Component
@Slf4j
public class JpaWikiPages implements WikiPages {

    private final WikiPageRepository wikiPageRepository;

    public JpaWikiPages(WikiPageRepository wikiPageRepository) {
        this.wikiPageRepository = wikiPageRepository;
    }

    @Override
    @Transactional
    public WikiPage add(WikiCreateRequest request) {
        if (request.pageName() == null || request.pageName().isBlank()) {
            throw new IllegalArgumentException("Wiki page name is required");
        }

        int revision = wikiPageRepository.findLatestRevision(request.pageName()) + 1;
        wikiPageRepository.clearCurrent(request.pageName());

        WikiPage page = wikiPageRepository.save(WikiPage.builder()
            .pageName(request.pageName())
            .revision(revision)
            .markup(request.markup() == null ? "" : request.markup())
            .revisionMessage(request.revisionMessage())
            .minorEdit(request.minorEdit())
            .authorId(request.authorId())
            .current(true)
            .build());

        log.debug("Saved revision {} of {}", revision, request.pageName());
        return page;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<WikiPage> page(String pageName) {
        return wikiPageRepository.findFirstByPageNameAndCurrentTrue(pageName);
    }
}
