package com.tasflow.model.forum;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "topic_watch", uniqueConstraints = @UniqueConstraint(
    name = "uk_topic_watch_topic_user", columnNames = {"topic_id", "user_id"}))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopicWatch {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "topic_id", nullable = false)
    private Long topicId;

    @Column(name = "user_id", nullable = false)
    private Long userId;
}
