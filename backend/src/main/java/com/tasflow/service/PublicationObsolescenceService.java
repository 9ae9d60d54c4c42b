package com.tasflow.service;

import com.tasflow.dto.response.ObsoletePublicationResult;
import com.tasflow.dto.response.ObsoleteResult;
import com.tasflow.integration.VideoDescriptor;
import com.tasflow.integration.VideoSync;
import com.tasflow.integration.WikiPageNames;
import com.tasflow.integration.WikiPages;
import com.tasflow.model.enums.FailureKind;
import com.tasflow.model.publication.Publication;
import com.tasflow.model.publication.PublicationUrl;
import com.tasflow.model.wiki.WikiPage;
import com.tasflow.repository.PublicationRepository;
import com.tasflow.service.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Maintains the obsoleted-by links between publications of a game.
 */
@Service
@Slf4j
public class PublicationObsolescenceService {

    private final PublicationRepository publicationRepository;
    private final WikiPages wikiPages;
    private final VideoSync videoSync;
    private final OutboxService outboxService;
    private final TransactionTemplate transactionTemplate;

    public PublicationObsolescenceService(
            PublicationRepository publicationRepository,
            WikiPages wikiPages,
            VideoSync videoSync,
            OutboxService outboxService,
            TransactionTemplate transactionTemplate) {
        this.publicationRepository = publicationRepository;
        this.wikiPages = wikiPages;
        this.videoSync = videoSync;
        this.outboxService = outboxService;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Mark a publication as obsoleted by another one, in its own transaction.
     */
    public ObsoleteResult obsoleteWith(Long toObsoleteId, Long obsoletingId) {
        try {
            transactionTemplate.executeWithoutResult(status -> obsolete(toObsoleteId, obsoletingId));
            log.info("Publication {} obsoleted by {}", toObsoleteId, obsoletingId);
            return ObsoleteResult.successful();
        } catch (WorkflowException e) {
            log.warn("Obsoleting publication {} with {} refused: {}", toObsoleteId, obsoletingId, e.getMessage());
            return ObsoleteResult.error(e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure obsoleting publication {} with {}", toObsoleteId, obsoletingId, e);
            return ObsoleteResult.error(FailureKind.UNEXPECTED, e.toString());
        }
    }

    /**
     * Set the obsoleted-by link and queue a video sync for each recognized streaming URL
     * of the obsoleted publication. Joins the caller's transaction.
     *
     * @throws WorkflowException when either publication is missing, they belong to different
     *         games, or the link would close a cycle
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void obsolete(Long toObsoleteId, Long obsoletingId) {
        if (toObsoleteId.equals(obsoletingId)) {
            throw WorkflowException.preconditionFailed("A publication can not obsolete itself");
        }

        Publication toObsolete = publicationRepository.findByIdWithSyncDetails(toObsoleteId)
            .orElseThrow(() -> WorkflowException.notFound("Publication " + toObsoleteId + " not found"));
        Long obsoletingGameId = publicationRepository.findGameIdById(obsoletingId)
            .orElseThrow(() -> WorkflowException.notFound("Publication " + obsoletingId + " not found"));

        if (!obsoletingGameId.equals(toObsolete.getGame().getId())) {
            throw WorkflowException.preconditionFailed(
                "Publication " + obsoletingId + " is not of the same game as " + toObsoleteId);
        }
        if (isObsoletedBy(obsoletingId, toObsoleteId)) {
            throw WorkflowException.preconditionFailed(
                "Publication " + obsoletingId + " is already obsoleted by " + toObsoleteId);
        }

        toObsolete.setObsoletedById(obsoletingId);
        publicationRepository.save(toObsolete);

        String markup = wikiPages.page(WikiPageNames.publication(toObsoleteId))
            .map(WikiPage::getMarkup)
            .orElse("");
        for (PublicationUrl url : toObsolete.streamingUrls()) {
            if (videoSync.isRecognizedUrl(url.getUrl())) {
                outboxService.enqueueVideoSync(toVideoDescriptor(toObsolete, url, markup));
            }
        }
    }

    /**
     * Title, tags and description of a publication about to be obsoleted.
     */
    @Transactional(readOnly = true)
    public Optional<ObsoletePublicationResult> getObsoletePublicationTags(Long publicationId) {
        return publicationRepository.findById(publicationId)
            .map(publication -> new ObsoletePublicationResult(
                publication.getTitle(),
                publicationRepository.findTagIdsById(publicationId),
                wikiPages.page(WikiPageNames.publication(publicationId))
                    .map(WikiPage::getMarkup)
                    .orElse("")));
    }

    VideoDescriptor toVideoDescriptor(Publication publication, PublicationUrl url, String markup) {
        return new VideoDescriptor(
            publication.getId(),
            publication.getCreatedAt(),
            url.getUrl(),
            url.getDisplayName(),
            publication.getTitle(),
            markup,
            publication.getSystem().getCode(),
            publication.authorNames(),
            publication.getObsoletedById());
    }

    /**
     * Whether {@code publicationId} is, directly or transitively, obsoleted by {@code candidateId}.
     */
    private boolean isObsoletedBy(Long publicationId, Long candidateId) {
        Set<Long> visited = new HashSet<>();
        Long current = publicationId;
        while (current != null && visited.add(current)) {
            Long next = publicationRepository.findObsoletedById(current).orElse(null);
            if (candidateId.equals(next)) {
                return true;
            }
            current = next;
        }
        return false;
    }
}
