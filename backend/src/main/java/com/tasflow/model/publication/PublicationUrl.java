package com.tasflow.model.publication;

import com.tasflow.model.enums.PublicationUrlType;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "publication_url", indexes = {
    @Index(name = "idx_publication_url_publication", columnList = "publication_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublicationUrl {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "publication_id", nullable = false)
    private Publication publication;

    @Column(nullable = false, length = 500)
    private String url;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PublicationUrlType type;

    @Column(name = "display_name", length = 100)
    private String displayName;
}
