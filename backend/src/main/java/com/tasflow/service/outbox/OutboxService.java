package com.tasflow.service.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasflow.integration.VideoDescriptor;
import com.tasflow.model.enums.OutboxTaskType;
import com.tasflow.model.outbox.OutboxTask;
import com.tasflow.repository.OutboxTaskRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Records downstream side effects as outbox tasks.
 *
 * Must be called inside the transaction of the change that causes the side effect,
 * so the task exists exactly when the change committed.
 */
@Service
@Slf4j
public class OutboxService {

    private final OutboxTaskRepository taskRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OutboxService(OutboxTaskRepository taskRepository, ObjectMapper objectMapper, Clock clock) {
        this.taskRepository = taskRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public OutboxTask enqueueVideoSync(VideoDescriptor video) {
        return enqueue(OutboxTaskType.VIDEO_SYNC, video);
    }

    public OutboxTask enqueueRoleGrant(List<Long> authorIds, String publicationTitle) {
        return enqueue(OutboxTaskType.GRANT_PUBLICATION_ROLES, new RoleGrantPayload(authorIds, publicationTitle));
    }

    public OutboxTask enqueuePublishedNotice(Long submissionId, Long publicationId) {
        return enqueue(OutboxTaskType.NOTIFY_PUBLISHED, new PublishedNoticePayload(submissionId, publicationId));
    }

    private OutboxTask enqueue(OutboxTaskType type, Object payload) {
        OutboxTask task = taskRepository.save(OutboxTask.builder()
            .type(type)
            .payload(toJson(payload))
            .createdAt(clock.instant())
            .build());
        log.debug("Queued {} task {}", type, task.getId());
        return task;
    }

    // ========================================================================
    // JSON Serialization
    // ========================================================================

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize outbox payload " + payload.getClass().getSimpleName(), e);
        }
    }

    <T> T fromJson(OutboxTask task, Class<T> type) {
        try {
            return objectMapper.readValue(task.getPayload(), type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed payload in outbox task " + task.getId(), e);
        }
    }
}
