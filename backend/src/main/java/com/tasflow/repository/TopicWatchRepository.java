package com.tasflow.repository;

import com.tasflow.model.forum.TopicWatch;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TopicWatchRepository extends JpaRepository<TopicWatch, Long> {

    boolean existsByTopicIdAndUserId(Long topicId, Long userId);

    long deleteByTopicIdAndUserId(Long topicId, Long userId);
}
