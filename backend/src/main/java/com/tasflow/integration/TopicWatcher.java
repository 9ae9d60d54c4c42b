package com.tasflow.integration;

public interface TopicWatcher {

    /**
     * Subscribe or unsubscribe a user to replies on a topic.
     */
    void watchTopic(Long topicId, Long userId, boolean enabled);
}
