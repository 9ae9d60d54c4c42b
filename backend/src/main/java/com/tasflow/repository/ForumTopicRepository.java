package com.tasflow.repository;

import com.tasflow.model.forum.ForumTopic;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ForumTopicRepository extends JpaRepository<ForumTopic, Long> {

    Optional<ForumTopic> findFirstBySubmissionId(Long submissionId);
}
