package com.tasflow.service;

import com.tasflow.dto.request.SubmitRequest;
import com.tasflow.dto.request.UpdateSubmissionRequest;
import com.tasflow.dto.response.SubmitResult;
import com.tasflow.dto.response.UpdateSubmissionResult;
import com.tasflow.helper.ConcurrencyHelper;
import com.tasflow.helper.MovieTitles;
import com.tasflow.helper.ViolationMessages;
import com.tasflow.ingest.IngestResult;
import com.tasflow.ingest.MovieFormatDeprecator;
import com.tasflow.ingest.ParseResult;
import com.tasflow.ingest.ParsedSubmissionData;
import com.tasflow.ingest.UploadedMovie;
import com.tasflow.integration.AutomationAgent;
import com.tasflow.integration.VideoSync;
import com.tasflow.integration.WikiCreateRequest;
import com.tasflow.integration.WikiPageNames;
import com.tasflow.integration.WikiPages;
import com.tasflow.model.enums.FailureKind;
import com.tasflow.model.enums.SubmissionStatus;
import com.tasflow.model.game.Game;
import com.tasflow.model.game.GameGoal;
import com.tasflow.model.game.GameVersion;
import com.tasflow.model.submission.Submission;
import com.tasflow.model.user.User;
import com.tasflow.repository.ForumPostRepository;
import com.tasflow.repository.ForumTopicRepository;
import com.tasflow.repository.GameGoalRepository;
import com.tasflow.repository.GameRepository;
import com.tasflow.repository.GameVersionRepository;
import com.tasflow.repository.PublicationClassRepository;
import com.tasflow.repository.RejectionReasonRepository;
import com.tasflow.repository.SubmissionRepository;
import com.tasflow.repository.SubmissionStatusHistoryRepository;
import com.tasflow.repository.UserRepository;
import com.tasflow.service.authorization.SubmissionAuthorizationService;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Creates and edits submissions.
 *
 * Status changes made through {@link #updateSubmission} are checked against
 * {@link SubmissionAuthorizationService#availableStatuses} before anything is written.
 */
@Service
@Slf4j
public class SubmissionService {

    private final SubmissionRepository submissionRepository;
    private final SubmissionStatusHistoryRepository historyRepository;
    private final UserRepository userRepository;
    private final GameRepository gameRepository;
    private final GameVersionRepository gameVersionRepository;
    private final GameGoalRepository gameGoalRepository;
    private final PublicationClassRepository publicationClassRepository;
    private final RejectionReasonRepository rejectionReasonRepository;
    private final ForumTopicRepository topicRepository;
    private final ForumPostRepository postRepository;
    private final MovieParserService movieParserService;
    private final MovieFormatDeprecator deprecator;
    private final SubmissionAuthorizationService authorizationService;
    private final WikiPages wikiPages;
    private final AutomationAgent automationAgent;
    private final VideoSync videoSync;
    private final TransactionTemplate transactionTemplate;
    private final Validator validator;
    private final Clock clock;
    private final long workbenchForumId;
    private final long playgroundForumId;
    private final long discardForumId;

    public SubmissionService(
            SubmissionRepository submissionRepository,
            SubmissionStatusHistoryRepository historyRepository,
            UserRepository userRepository,
            GameRepository gameRepository,
            GameVersionRepository gameVersionRepository,
            GameGoalRepository gameGoalRepository,
            PublicationClassRepository publicationClassRepository,
            RejectionReasonRepository rejectionReasonRepository,
            ForumTopicRepository topicRepository,
            ForumPostRepository postRepository,
            MovieParserService movieParserService,
            MovieFormatDeprecator deprecator,
            SubmissionAuthorizationService authorizationService,
            WikiPages wikiPages,
            AutomationAgent automationAgent,
            VideoSync videoSync,
            TransactionTemplate transactionTemplate,
            Validator validator,
            Clock clock,
            @Value("${tasflow.forum.workbench-forum-id:7}") long workbenchForumId,
            @Value("${tasflow.forum.playground-forum-id:8}") long playgroundForumId,
            @Value("${tasflow.forum.discard-forum-id:24}") long discardForumId) {
        this.submissionRepository = submissionRepository;
        this.historyRepository = historyRepository;
        this.userRepository = userRepository;
        this.gameRepository = gameRepository;
        this.gameVersionRepository = gameVersionRepository;
        this.gameGoalRepository = gameGoalRepository;
        this.publicationClassRepository = publicationClassRepository;
        this.rejectionReasonRepository = rejectionReasonRepository;
        this.topicRepository = topicRepository;
        this.postRepository = postRepository;
        this.movieParserService = movieParserService;
        this.deprecator = deprecator;
        this.authorizationService = authorizationService;
        this.wikiPages = wikiPages;
        this.automationAgent = automationAgent;
        this.videoSync = videoSync;
        this.transactionTemplate = transactionTemplate;
        this.validator = validator;
        this.clock = clock;
        this.workbenchForumId = workbenchForumId;
        this.playgroundForumId = playgroundForumId;
        this.discardForumId = discardForumId;
    }

    // ========================================================================
    // Submit
    // ========================================================================

    public SubmitResult submit(SubmitRequest request) {
        Set<ConstraintViolation<SubmitRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            return SubmitResult.failed(FailureKind.VALIDATION_FAILED, ViolationMessages.describe(violations));
        }

        try {
            IngestResult ingest = ingest(request.movieFile());
            Submission submission = transactionTemplate.execute(status -> doSubmit(request, ingest));
            log.info("Created submission {}", submission.getTitle());
            return SubmitResult.successful(submission.getId(), submission.getTitle());
        } catch (WorkflowException e) {
            log.warn("Submission by user {} refused: {}", request.submitterId(), e.getMessage());
            return SubmitResult.failed(e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure creating submission for user {}", request.submitterId(), e);
            return SubmitResult.failed(FailureKind.UNEXPECTED, e.toString());
        }
    }

    private Submission doSubmit(SubmitRequest request, IngestResult ingest) {
        User submitter = userRepository.findById(request.submitterId())
            .orElseThrow(() -> WorkflowException.notFound("Submitter " + request.submitterId() + " not found"));
        List<User> authors = resolveAuthors(request.authors());

        Submission submission = Submission.builder()
            .submitter(submitter)
            .gameName(request.gameName())
            .submittedGameVersion(request.gameVersion())
            .branch(MovieTitles.trimQuotes(request.goal()))
            .romName(request.romName())
            .emulatorVersion(request.emulator())
            .encodeEmbedLink(videoSync.toEmbedLink(request.encodeEmbedLink()))
            .additionalAuthors(MovieTitles.normalizeCsv(request.externalAuthors()))
            .createdAt(clock.instant())
            .build();
        applyMovie(submission, ingest);

        // the title embeds the id, so save once before generating it
        submissionRepository.saveAndFlush(submission);

        wikiPages.add(new WikiCreateRequest(
            WikiPageNames.submission(submission.getId()),
            request.markup(),
            submitter.getId(),
            "Auto-generated from Submission #" + submission.getId()));

        submission.replaceAuthors(authors);
        submission.generateTitle();
        submission.setTopicId(automationAgent.postSubmissionTopic(submission.getId(), submission.getTitle()));
        return submissionRepository.save(submission);
    }

    // ========================================================================
    // Update
    // ========================================================================

    public UpdateSubmissionResult updateSubmission(UpdateSubmissionRequest request) {
        Set<ConstraintViolation<UpdateSubmissionRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            return UpdateSubmissionResult.error(FailureKind.VALIDATION_FAILED, ViolationMessages.describe(violations));
        }

        UpdateOutcome outcome;
        try {
            IngestResult replacement = request.replaceMovieFile() != null ? ingest(request.replaceMovieFile()) : null;
            outcome = transactionTemplate.execute(status -> doUpdate(request, replacement));
        } catch (WorkflowException e) {
            log.warn("Update of submission {} by {} refused: {}", request.submissionId(), request.userName(), e.getMessage());
            return UpdateSubmissionResult.error(e.getKind(), e.getMessage());
        } catch (ConcurrencyFailureException e) {
            log.warn("Update of submission {} by {} lost a write race", request.submissionId(), request.userName(), e);
            return UpdateSubmissionResult.error(FailureKind.PRECONDITION_FAILED,
                "Submission was modified by another user, reload and try again");
        } catch (RuntimeException e) {
            log.error("Unexpected failure updating submission {}", request.submissionId(), e);
            return UpdateSubmissionResult.error(FailureKind.UNEXPECTED, e.toString());
        }

        log.info("Submission {} updated by {} ({} -> {})",
            request.submissionId(), request.userName(), outcome.previousStatus(), request.status());
        retitleTopic(outcome.topicId(), outcome.title());
        return UpdateSubmissionResult.successful(outcome.previousStatus(), outcome.title());
    }

    private UpdateOutcome doUpdate(UpdateSubmissionRequest request, IngestResult replacement) {
        Submission submission = submissionRepository.findByIdWithDetails(request.submissionId())
            .orElseThrow(() -> WorkflowException.notFound("Submission " + request.submissionId() + " not found"));

        if (submission.getStatus() == SubmissionStatus.PUBLISHED) {
            throw WorkflowException.preconditionFailed("Published submissions can not be edited");
        }
        if (request.version() != null && !request.version().equals(submission.getVersion())) {
            throw WorkflowException.preconditionFailed("Submission was modified by another user, reload and try again");
        }

        SubmissionStatus prior = submission.getStatus();
        SubmissionStatus next = request.status();
        Set<SubmissionStatus> available = authorizationService.availableStatuses(
            prior,
            request.permissions(),
            submission.getCreatedAt(),
            submission.isAuthorOrSubmitter(request.userId()),
            submission.isJudgedBy(request.userId()),
            submission.isPublishedBy(request.userId()));
        if (!available.contains(next)) {
            throw WorkflowException.preconditionFailed("Status " + next.getValue() + " is not available");
        }

        if (replacement != null) {
            applyMovie(submission, replacement);
        }

        if (next != prior) {
            applyClaims(submission, prior, next, request.userId());
            historyRepository.append(submission.getId(), prior, next, clock.instant());
            submission.setStatus(next);
            moveTopic(submission.getTopicId(), next);
            if (next.isDiscarded()) {
                automationAgent.postSubmissionDiscarded(submission.getId(), next);
            }
        }

        submission.setRejectionReason(next == SubmissionStatus.REJECTED && request.rejectionReasonId() != null
            ? rejectionReasonRepository.findById(request.rejectionReasonId())
                .orElseThrow(() -> WorkflowException.validationFailed("Unknown rejection reason " + request.rejectionReasonId()))
            : null);
        submission.setIntendedClass(request.intendedClassId() != null
            ? publicationClassRepository.findById(request.intendedClassId())
                .orElseThrow(() -> WorkflowException.validationFailed("Unknown publication class " + request.intendedClassId()))
            : null);
        if (request.gameId() != null) {
            applyCatalog(submission, request.gameId(), request.gameVersionId(), request.gameGoalId());
        }

        submission.setGameName(request.gameName());
        submission.setSubmittedGameVersion(request.gameVersion());
        submission.setBranch(MovieTitles.trimQuotes(request.goal()));
        submission.setRomName(request.romName());
        submission.setEmulatorVersion(request.emulator());
        submission.setEncodeEmbedLink(videoSync.toEmbedLink(request.encodeEmbedLink()));
        submission.setAdditionalAuthors(MovieTitles.normalizeCsv(request.externalAuthors()));
        if (request.authors() != null) {
            submission.replaceAuthors(resolveAuthors(request.authors()));
        }
        submission.generateTitle();

        if (request.markupChanged()) {
            wikiPages.add(new WikiCreateRequest(
                WikiPageNames.submission(submission.getId()),
                request.markup(),
                request.userId(),
                request.revisionMessage(),
                request.minorEdit()));
        }

        // flush now so a concurrent write surfaces here, inside the transaction
        submissionRepository.saveAndFlush(submission);
        return new UpdateOutcome(prior, submission.getTitle(), submission.getTopicId());
    }

    /**
     * Judge and publisher follow the status: taking the claimed status assigns the actor,
     * going back releases the claim.
     */
    private void applyClaims(Submission submission, SubmissionStatus prior, SubmissionStatus next, Long userId) {
        if (next == SubmissionStatus.NEW) {
            submission.setJudge(null);
            submission.setPublisher(null);
            return;
        }
        if (next == SubmissionStatus.JUDGING_UNDERWAY && !submission.isJudgedBy(userId)) {
            submission.setJudge(findActor(userId));
        }
        if (next == SubmissionStatus.PUBLICATION_UNDERWAY) {
            submission.setPublisher(findActor(userId));
        } else if (prior == SubmissionStatus.PUBLICATION_UNDERWAY && next == SubmissionStatus.ACCEPTED) {
            submission.setPublisher(null);
        }
    }

    private void applyCatalog(Submission submission, Long gameId, Long gameVersionId, Long gameGoalId) {
        Game game = gameRepository.findById(gameId)
            .orElseThrow(() -> WorkflowException.validationFailed("Unknown game " + gameId));

        GameVersion version = null;
        if (gameVersionId != null) {
            version = gameVersionRepository.findById(gameVersionId)
                .filter(v -> Objects.equals(v.getGame().getId(), gameId))
                .orElseThrow(() -> WorkflowException.validationFailed(
                    "Game version " + gameVersionId + " does not belong to game " + gameId));
        }

        GameGoal goal = null;
        if (gameGoalId != null) {
            goal = gameGoalRepository.findById(gameGoalId)
                .filter(g -> Objects.equals(g.getGame().getId(), gameId))
                .orElseThrow(() -> WorkflowException.validationFailed(
                    "Goal " + gameGoalId + " does not belong to game " + gameId));
        }

        submission.setGame(game);
        submission.setGameVersion(version);
        submission.setGameGoal(goal);
    }

    private void moveTopic(Long topicId, SubmissionStatus next) {
        if (topicId == null) {
            return;
        }
        Long targetForum;
        if (next == SubmissionStatus.PLAYGROUND) {
            targetForum = playgroundForumId;
        } else if (next.isDiscarded()) {
            targetForum = discardForumId;
        } else if (next.isWorkInProgress()) {
            targetForum = workbenchForumId;
        } else {
            return;
        }

        topicRepository.findById(topicId)
            .filter(topic -> !targetForum.equals(topic.getForumId()))
            .ifPresent(topic -> {
                topic.setForumId(targetForum);
                postRepository.moveTopicPosts(topicId, targetForum);
                log.debug("Moved topic {} to forum {}", topicId, targetForum);
            });
    }

    private void retitleTopic(Long topicId, String title) {
        if (topicId == null) {
            return;
        }
        try {
            boolean retitled = ConcurrencyHelper.executeWithRetry(() -> transactionTemplate.executeWithoutResult(
                status -> topicRepository.findById(topicId).ifPresent(topic -> topic.setTitle(title))));
            if (!retitled) {
                log.warn("Could not retitle topic {} after repeated conflicts", topicId);
            }
        } catch (RuntimeException e) {
            log.warn("Retitling topic {} failed, submission update is kept", topicId, e);
        }
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public long getSubmissionCount(Long userId) {
        return submissionRepository.countBySubmitterId(userId);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private IngestResult ingest(UploadedMovie upload) {
        IngestResult ingest = movieParserService.parseMovieFileOrZip(upload);
        ParseResult parseResult = ingest.parseResult();
        if (!ingest.success()) {
            throw WorkflowException.validationFailed("Movie file could not be parsed: " + String.join(", ", parseResult.errors()));
        }
        if (deprecator.isDeprecated(parseResult.fileExtension())) {
            throw WorkflowException.validationFailed("." + parseResult.fileExtension() + " is no longer submittable");
        }
        return ingest;
    }

    private void applyMovie(Submission submission, IngestResult ingest) {
        ParseResult parseResult = ingest.parseResult();
        ParsedSubmissionData data = movieParserService.mapParsedResult(parseResult)
            .orElseThrow(() -> WorkflowException.validationFailed("Unknown system type of " + parseResult.systemCode()));

        submission.setFrames(data.frames());
        submission.setRerecordCount(data.rerecordCount());
        submission.setMovieExtension(data.movieExtension());
        submission.setSystem(data.system());
        submission.setSystemFrameRate(data.systemFrameRate());
        submission.setAnnotations(data.annotations());
        submission.setWarnings(data.warnings());
        submission.setMovieFile(ingest.movieFileBytes());
        parseResult.primaryHash().ifPresentOrElse(
            hash -> {
                submission.setHashType(hash.getKey().name());
                submission.setHash(hash.getValue());
            },
            () -> {
                submission.setHashType(null);
                submission.setHash(null);
            });
    }

    /**
     * Users for the given names, in the given order.
     */
    private List<User> resolveAuthors(List<String> userNames) {
        Set<String> names = new LinkedHashSet<>(userNames);
        Map<String, User> byName = userRepository.findByUserNameIn(names).stream()
            .collect(Collectors.toMap(User::getUserName, Function.identity()));

        List<String> unknown = names.stream().filter(n -> !byName.containsKey(n)).toList();
        if (!unknown.isEmpty()) {
            throw WorkflowException.validationFailed("Unknown authors: " + String.join(", ", unknown));
        }
        return names.stream().map(byName::get).toList();
    }

    private User findActor(Long userId) {
        return userRepository.findById(userId)
            .orElseThrow(() -> WorkflowException.notFound("User " + userId + " not found"));
    }

    private record UpdateOutcome(SubmissionStatus previousStatus, String title, Long topicId) {}
}
