package com.tasflow.service.outbox;

public record PublishedNoticePayload(Long submissionId, Long publicationId) {}
