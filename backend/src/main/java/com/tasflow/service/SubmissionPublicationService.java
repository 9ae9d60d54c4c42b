package com.tasflow.service;

import com.tasflow.dto.request.PublishSubmissionRequest;
import com.tasflow.dto.response.PublishSubmissionResult;
import com.tasflow.helper.ViolationMessages;
import com.tasflow.integration.VideoSync;
import com.tasflow.integration.WikiCreateRequest;
import com.tasflow.integration.WikiPageNames;
import com.tasflow.integration.WikiPages;
import com.tasflow.model.enums.FailureKind;
import com.tasflow.model.enums.SubmissionStatus;
import com.tasflow.model.file.MovieFile;
import com.tasflow.model.publication.Publication;
import com.tasflow.model.publication.PublicationUrl;
import com.tasflow.model.submission.Submission;
import com.tasflow.repository.FlagRepository;
import com.tasflow.repository.PublicationRepository;
import com.tasflow.repository.SubmissionRepository;
import com.tasflow.repository.SubmissionStatusHistoryRepository;
import com.tasflow.repository.TagRepository;
import com.tasflow.service.outbox.OutboxService;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Turns a submission under publication into a publication.
 *
 * Everything authoritative happens in one transaction: the publication with its movie file,
 * urls, authors, flags and tags, its wiki page, the status flip with history, and the optional
 * obsoletion. Video syncs, role grants and the forum notice are queued as outbox tasks in the
 * same transaction and delivered after commit by the outbox worker.
 */
@Service
@Slf4j
public class SubmissionPublicationService {

    private final SubmissionRepository submissionRepository;
    private final SubmissionStatusHistoryRepository historyRepository;
    private final PublicationRepository publicationRepository;
    private final FlagRepository flagRepository;
    private final TagRepository tagRepository;
    private final WikiPages wikiPages;
    private final VideoSync videoSync;
    private final PublicationObsolescenceService obsolescenceService;
    private final OutboxService outboxService;
    private final TransactionTemplate transactionTemplate;
    private final Validator validator;
    private final Clock clock;

    public SubmissionPublicationService(
            SubmissionRepository submissionRepository,
            SubmissionStatusHistoryRepository historyRepository,
            PublicationRepository publicationRepository,
            FlagRepository flagRepository,
            TagRepository tagRepository,
            WikiPages wikiPages,
            VideoSync videoSync,
            PublicationObsolescenceService obsolescenceService,
            OutboxService outboxService,
            TransactionTemplate transactionTemplate,
            Validator validator,
            Clock clock) {
        this.submissionRepository = submissionRepository;
        this.historyRepository = historyRepository;
        this.publicationRepository = publicationRepository;
        this.flagRepository = flagRepository;
        this.tagRepository = tagRepository;
        this.wikiPages = wikiPages;
        this.videoSync = videoSync;
        this.obsolescenceService = obsolescenceService;
        this.outboxService = outboxService;
        this.transactionTemplate = transactionTemplate;
        this.validator = validator;
        this.clock = clock;
    }

    public PublishSubmissionResult publish(PublishSubmissionRequest request) {
        Set<ConstraintViolation<PublishSubmissionRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            return PublishSubmissionResult.failed(FailureKind.VALIDATION_FAILED, ViolationMessages.describe(violations));
        }

        try {
            Publication publication = transactionTemplate.execute(status -> doPublish(request));
            log.info("Submission {} published as {}", request.submissionId(), publication.getTitle());
            return PublishSubmissionResult.successful(publication.getId(), publication.getTitle());
        } catch (WorkflowException e) {
            log.warn("Publishing submission {} refused: {}", request.submissionId(), e.getMessage());
            return PublishSubmissionResult.failed(e.getKind(), e.getMessage());
        } catch (ConcurrencyFailureException e) {
            log.warn("Publishing submission {} lost a write race", request.submissionId(), e);
            return PublishSubmissionResult.failed(FailureKind.PRECONDITION_FAILED,
                "Submission " + request.submissionId() + " was changed by another user");
        } catch (DataIntegrityViolationException e) {
            // the filename check and the insert are not atomic; the unique index settles the race
            String movieFileName = request.movieFileNameWithExtension();
            if (publicationRepository.existsByMovieFileName(movieFileName)) {
                log.warn("Publishing submission {} lost the race for movie filename {}", request.submissionId(), movieFileName);
                return PublishSubmissionResult.failed(FailureKind.PRECONDITION_FAILED,
                    "Movie filename " + movieFileName + " already exists");
            }
            log.error("Publishing submission {} failed and was rolled back", request.submissionId(), e);
            return PublishSubmissionResult.failed(FailureKind.UNEXPECTED, describe(e));
        } catch (RuntimeException e) {
            log.error("Publishing submission {} failed and was rolled back", request.submissionId(), e);
            return PublishSubmissionResult.failed(FailureKind.UNEXPECTED, describe(e));
        }
    }

    private Publication doPublish(PublishSubmissionRequest request) {
        Long submissionId = request.submissionId();
        Submission submission = submissionRepository.findByIdWithDetails(submissionId)
            .orElseThrow(() -> WorkflowException.notFound("Submission " + submissionId + " not found"));
        if (!submission.canPublish()) {
            throw WorkflowException.preconditionFailed(
                "Submission " + submissionId + " is " + submission.getStatus().getValue() + " and can not be published");
        }
        requirePublishable(submission);

        String movieFileName = request.movieFileNameWithExtension();
        if (publicationRepository.existsByMovieFileName(movieFileName)) {
            throw WorkflowException.preconditionFailed("Movie filename " + movieFileName + " already exists");
        }

        Long toObsolete = request.movieToObsolete();
        if (toObsolete != null && !publicationRepository.existsById(toObsolete)) {
            throw WorkflowException.notFound("Publication to obsolete " + toObsolete + " not found");
        }

        Instant now = clock.instant();
        Publication publication = buildPublication(submission, request, movieFileName, now);

        // the title embeds the id, so save once before generating it
        publicationRepository.saveAndFlush(publication);
        publication.generateTitle();

        wikiPages.add(new WikiCreateRequest(
            WikiPageNames.publication(publication.getId()),
            request.movieDescription(),
            request.userId(),
            "Auto-generated from Movie #" + submissionId));

        SubmissionStatus prior = submission.getStatus();
        int updated = submissionRepository.transitionStatus(
            submissionId, submission.getVersion(), prior, SubmissionStatus.PUBLISHED, now);
        if (updated == 0) {
            throw WorkflowException.preconditionFailed("Submission " + submissionId + " was changed by another user");
        }
        historyRepository.append(submissionId, prior, SubmissionStatus.PUBLISHED, now);

        if (toObsolete != null) {
            obsolescenceService.obsolete(toObsolete, publication.getId());
        }

        outboxService.enqueueRoleGrant(publication.authorIds(), publication.getTitle());
        outboxService.enqueuePublishedNotice(submissionId, publication.getId());
        for (PublicationUrl url : publication.streamingUrls()) {
            if (videoSync.isRecognizedUrl(url.getUrl())) {
                outboxService.enqueueVideoSync(
                    obsolescenceService.toVideoDescriptor(publication, url, request.movieDescription()));
            }
        }
        return publication;
    }

    private Publication buildPublication(Submission submission, PublishSubmissionRequest request,
                                         String movieFileName, Instant now) {
        byte[] movieBytes = submission.getMovieFile() == null ? new byte[0] : submission.getMovieFile();

        Publication publication = Publication.builder()
            .submission(submission)
            .publicationClass(submission.getIntendedClass())
            .system(submission.getSystem())
            .systemFrameRate(submission.getSystemFrameRate())
            .game(submission.getGame())
            .gameVersion(submission.getGameVersion())
            .gameGoal(submission.getGameGoal())
            .emulatorVersion(submission.getEmulatorVersion())
            .frames(submission.getFrames())
            .rerecordCount(submission.getRerecordCount())
            .additionalAuthors(submission.getAdditionalAuthors())
            .movieFileName(movieFileName)
            .movieFile(MovieFile.builder()
                .fileName(movieFileName)
                .fileData(Arrays.copyOf(movieBytes, movieBytes.length))
                .originalLength(movieBytes.length)
                .createdAt(now)
                .build())
            .createdAt(now)
            .build();

        publication.addStreamingUrl(request.onlineWatchingUrl(), null);
        publication.addStreamingUrl(request.alternateOnlineWatchingUrl(), request.alternateOnlineWatchUrlName());
        publication.addMirrorUrl(request.mirrorSiteUrl());
        publication.copyAuthorsFrom(submission.getAuthors());

        if (request.selectedFlags() != null && !request.selectedFlags().isEmpty()) {
            publication.setFlags(new HashSet<>(flagRepository.findAllById(request.selectedFlags())));
        }
        if (request.selectedTags() != null && !request.selectedTags().isEmpty()) {
            publication.setTags(new HashSet<>(tagRepository.findAllById(request.selectedTags())));
        }
        return publication;
    }

    private static void requirePublishable(Submission submission) {
        if (submission.getIntendedClass() == null) {
            throw WorkflowException.validationFailed("Submission has no intended publication class");
        }
        if (submission.getSystem() == null || submission.getSystemFrameRate() == null) {
            throw WorkflowException.validationFailed("Submission has no system or frame rate");
        }
        if (submission.getGame() == null || submission.getGameVersion() == null) {
            throw WorkflowException.validationFailed("Submission has no catalogued game and version");
        }
    }

    private static String describe(RuntimeException e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root == e ? e.toString() : e + " (caused by " + root + ")";
    }
}
