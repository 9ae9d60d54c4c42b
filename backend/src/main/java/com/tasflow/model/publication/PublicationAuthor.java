package com.tasflow.model.publication;

import com.tasflow.model.user.User;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "publication_author", indexes = {
    @Index(name = "idx_publication_author_publication", columnList = "publication_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublicationAuthor {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "publication_id", nullable = false)
    private Publication publication;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User author;

    @Column(nullable = false)
    private int ordinal;
}
