package com.tasflow.integration;

import com.tasflow.model.enums.SubmissionStatus;
import com.tasflow.model.forum.ForumPost;
import com.tasflow.model.forum.ForumTopic;
import com.tasflow.repository.ForumPostRepository;
import com.tasflow.repository.ForumTopicRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Posts workflow notices to the forum as the site automation account.
 */
@Component
@Slf4j
public class ForumAutomationAgent implements AutomationAgent {

    private final ForumTopicRepository topicRepository;
    private final ForumPostRepository postRepository;
    private final long workbenchForumId;
    private final String agentName;

    public ForumAutomationAgent(
            ForumTopicRepository topicRepository,
            ForumPostRepository postRepository,
            @Value("${tasflow.forum.workbench-forum-id:7}") long workbenchForumId,
            @Value("${tasflow.forum.agent-name:TASVideoAgent}") String agentName) {
        this.topicRepository = topicRepository;
        this.postRepository = postRepository;
        this.workbenchForumId = workbenchForumId;
        this.agentName = agentName;
    }

    @Override
    @Transactional
    public Long postSubmissionTopic(Long submissionId, String title) {
        ForumTopic topic = topicRepository.save(ForumTopic.builder()
            .forumId(workbenchForumId)
            .title(title)
            .submissionId(submissionId)
            .build());

        postRepository.save(ForumPost.builder()
            .topicId(topic.getId())
            .forumId(workbenchForumId)
            .posterName(agentName)
            .text("[submission]" + submissionId + "[/submission]")
            .build());

        return topic.getId();
    }

    @Override
    @Transactional
    public void postSubmissionPublished(Long submissionId, Long publicationId) {
        topicRepository.findFirstBySubmissionId(submissionId)
            .ifPresentOrElse(
                topic -> postRepository.save(ForumPost.builder()
                    .topicId(topic.getId())
                    .forumId(topic.getForumId())
                    .posterName(agentName)
                    .text("This movie has been published. [publication]" + publicationId + "[/publication]")
                    .build()),
                () -> log.warn("No discussion topic for submission {}, publish notice skipped", submissionId));
    }

    @Override
    @Transactional
    public void postSubmissionDiscarded(Long submissionId, SubmissionStatus status) {
        String verdict = status == SubmissionStatus.CANCELLED ? "cancelled" : "rejected";
        topicRepository.findFirstBySubmissionId(submissionId)
            .ifPresentOrElse(
                topic -> postRepository.save(ForumPost.builder()
                    .topicId(topic.getId())
                    .forumId(topic.getForumId())
                    .posterName(agentName)
                    .text("This submission has been " + verdict + ". [submission]" + submissionId + "[/submission]")
                    .build()),
                () -> log.warn("No discussion topic for submission {}, {} notice skipped", submissionId, verdict));
    }
}
