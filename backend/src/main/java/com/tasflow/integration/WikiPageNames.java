package com.tasflow.integration;

public final class WikiPageNames {

    public static final String SUBMISSION_PREFIX = "InternalSystem/SubmissionContent/S";
    public static final String PUBLICATION_PREFIX = "InternalSystem/PublicationContent/M";

    private WikiPageNames() {
    }

    public static String submission(Long submissionId) {
        return SUBMISSION_PREFIX + submissionId;
    }

    public static String publication(Long publicationId) {
        return PUBLICATION_PREFIX + publicationId;
    }
}
