package com.tasflow.model.forum;

import com.tasflow.model.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

/**
 * Discussion topic attached to a submission.
 */
@Entity
@Table(name = "forum_topic", indexes = {
    @Index(name = "idx_forum_topic_forum", columnList = "forum_id")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class ForumTopic extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    @Builder.Default
    private Long version = 0L;

    @Column(name = "forum_id", nullable = false)
    private Long forumId;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(name = "submission_id")
    private Long submissionId;
}
