package com.tasflow.integration;

import com.tasflow.model.forum.TopicWatch;
import com.tasflow.repository.TopicWatchRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class JpaTopicWatcher implements TopicWatcher {

    private final TopicWatchRepository topicWatchRepository;

    public JpaTopicWatcher(TopicWatchRepository topicWatchRepository) {
        this.topicWatchRepository = topicWatchRepository;
    }

    @Override
    @Transactional
    public void watchTopic(Long topicId, Long userId, boolean enabled) {
        boolean watching = topicWatchRepository.existsByTopicIdAndUserId(topicId, userId);
        if (enabled && !watching) {
            topicWatchRepository.save(TopicWatch.builder()
                .topicId(topicId)
                .userId(userId)
                .build());
        } else if (!enabled && watching) {
            topicWatchRepository.deleteByTopicIdAndUserId(topicId, userId);
        }
    }
}
