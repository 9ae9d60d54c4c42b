package com.tasflow.repository;

import com.tasflow.model.forum.ForumPost;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ForumPostRepository extends JpaRepository<ForumPost, Long> {

    List<ForumPost> findByTopicIdOrderByIdAsc(Long topicId);

    /**
     * Move every post of a topic along with the topic.
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE ForumPost p SET p.forumId = :forumId WHERE p.topicId = :topicId")
    int moveTopicPosts(@Param("topicId") Long topicId, @Param("forumId") Long forumId);
}
