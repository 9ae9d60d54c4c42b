package com.tasflow.model.submission;

import com.tasflow.model.user.User;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "submission_author", indexes = {
    @Index(name = "idx_submission_author_submission", columnList = "submission_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionAuthor {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "submission_id", nullable = false)
    private Submission submission;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User author;

    @Column(nullable = false)
    private int ordinal;
}
