package com.tasflow.integration;

import com.tasflow.model.enums.SubmissionStatus;

/**
 * Site automation account that posts workflow notices.
 */
public interface AutomationAgent {

    /**
     * Create the discussion topic for a new submission.
     *
     * @return id of the created topic
     */
    Long postSubmissionTopic(Long submissionId, String title);

    void postSubmissionPublished(Long submissionId, Long publicationId);

    /**
     * Announce in the discussion topic that a submission was rejected or cancelled.
     */
    void postSubmissionDiscarded(Long submissionId, SubmissionStatus status);
}
