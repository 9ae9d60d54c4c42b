package com.tasflow.model.forum;

import com.tasflow.model.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

@Entity
@Table(name = "forum_post", indexes = {
    @Index(name = "idx_forum_post_topic", columnList = "topic_id")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class ForumPost extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "topic_id", nullable = false)
    private Long topicId;

    @Column(name = "forum_id", nullable = false)
    private Long forumId;

    @Column(name = "poster_name", nullable = false, length = 100)
    private String posterName;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String text;
}
