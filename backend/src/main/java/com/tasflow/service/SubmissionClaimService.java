package com.tasflow.service;

import com.tasflow.dto.response.ClaimSubmissionResult;
import com.tasflow.integration.TopicWatcher;
import com.tasflow.integration.WikiCreateRequest;
import com.tasflow.integration.WikiPageNames;
import com.tasflow.integration.WikiPages;
import com.tasflow.model.enums.FailureKind;
import com.tasflow.model.enums.SubmissionStatus;
import com.tasflow.model.submission.Submission;
import com.tasflow.model.user.User;
import com.tasflow.model.wiki.WikiPage;
import com.tasflow.repository.SubmissionRepository;
import com.tasflow.repository.SubmissionStatusHistoryRepository;
import com.tasflow.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;

/**
 * Exclusive claims of a submission by a judge or a publisher.
 *
 * A claim is a conditional write on the status and version the submission was loaded with.
 * Two actors racing for the same submission both pass the read, but only the first write
 * matches; the other affects no rows and its transaction is rolled back. Claims are not retried.
 */
@Service
@Slf4j
public class SubmissionClaimService {

    private final SubmissionRepository submissionRepository;
    private final SubmissionStatusHistoryRepository historyRepository;
    private final UserRepository userRepository;
    private final WikiPages wikiPages;
    private final TopicWatcher topicWatcher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public SubmissionClaimService(
            SubmissionRepository submissionRepository,
            SubmissionStatusHistoryRepository historyRepository,
            UserRepository userRepository,
            WikiPages wikiPages,
            TopicWatcher topicWatcher,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        this.submissionRepository = submissionRepository;
        this.historyRepository = historyRepository;
        this.userRepository = userRepository;
        this.wikiPages = wikiPages;
        this.topicWatcher = topicWatcher;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    // ========================================================================
    // Claims
    // ========================================================================

    /**
     * Take a new submission for judging. The judge is subscribed to the discussion topic.
     */
    public ClaimSubmissionResult claimForJudging(Long submissionId, Long userId, String userName) {
        return claim(submissionId, userId, userName, ClaimStage.JUDGING);
    }

    /**
     * Take an accepted submission for publication.
     */
    public ClaimSubmissionResult claimForPublishing(Long submissionId, Long userId, String userName) {
        return claim(submissionId, userId, userName, ClaimStage.PUBLISHING);
    }

    private ClaimSubmissionResult claim(Long submissionId, Long userId, String userName, ClaimStage stage) {
        try {
            String title = transactionTemplate.execute(status -> doClaim(submissionId, userId, userName, stage));
            log.info("Submission {} claimed for {} by {}", submissionId, stage.label, userName);
            return ClaimSubmissionResult.successful(title);
        } catch (WorkflowException e) {
            log.warn("Claim of submission {} for {} by {} refused: {}",
                submissionId, stage.label, userName, e.getMessage());
            return ClaimSubmissionResult.error(e.getKind(), e.getMessage());
        } catch (DataAccessException e) {
            log.warn("Claim of submission {} for {} by {} lost a write race", submissionId, stage.label, userName, e);
            return ClaimSubmissionResult.error(FailureKind.PRECONDITION_FAILED, "Unable to claim");
        } catch (RuntimeException e) {
            log.error("Unexpected failure claiming submission {} for {}", submissionId, stage.label, e);
            return ClaimSubmissionResult.error(FailureKind.UNEXPECTED, "Unable to claim");
        }
    }

    private String doClaim(Long submissionId, Long userId, String userName, ClaimStage stage) {
        Submission submission = submissionRepository.findById(submissionId)
            .orElseThrow(() -> WorkflowException.notFound("Submission not found"));

        if (submission.getStatus() != stage.requiredStatus) {
            throw WorkflowException.preconditionFailed("Submission can not be claimed");
        }

        User actor = userRepository.findById(userId)
            .orElseThrow(() -> WorkflowException.notFound("User not found"));

        String pageName = WikiPageNames.submission(submissionId);
        String markup = wikiPages.page(pageName).map(WikiPage::getMarkup).orElse("");
        Long topicId = submission.getTopicId();
        String title = submission.getTitle();
        Instant now = clock.instant();

        int updated = stage == ClaimStage.JUDGING
            ? submissionRepository.claimForJudging(
                submissionId, submission.getVersion(), stage.requiredStatus, stage.targetStatus, actor, now)
            : submissionRepository.claimForPublishing(
                submissionId, submission.getVersion(), stage.requiredStatus, stage.targetStatus, actor, now);
        if (updated == 0) {
            throw WorkflowException.preconditionFailed("Unable to claim");
        }

        historyRepository.append(submissionId, stage.requiredStatus, stage.targetStatus, now);

        wikiPages.add(new WikiCreateRequest(
            pageName,
            markup + "\n----\n[user:" + userName + "]: " + stage.note,
            userId,
            stage.revisionMessage));

        if (stage.watchTopic && topicId != null) {
            topicWatcher.watchTopic(topicId, userId, true);
        }
        return title;
    }

    private enum ClaimStage {
        JUDGING("judging", SubmissionStatus.NEW, SubmissionStatus.JUDGING_UNDERWAY,
            "Claiming for judging.", "Claimed for judging", true),
        PUBLISHING("publication", SubmissionStatus.ACCEPTED, SubmissionStatus.PUBLICATION_UNDERWAY,
            "Processing...", "Claimed for publication", false);

        private final String label;
        private final SubmissionStatus requiredStatus;
        private final SubmissionStatus targetStatus;
        private final String note;
        private final String revisionMessage;
        private final boolean watchTopic;

        ClaimStage(String label, SubmissionStatus requiredStatus, SubmissionStatus targetStatus,
                   String note, String revisionMessage, boolean watchTopic) {
            this.label = label;
            this.requiredStatus = requiredStatus;
            this.targetStatus = targetStatus;
            this.note = note;
            this.revisionMessage = revisionMessage;
            this.watchTopic = watchTopic;
        }
    }
}
