package com.tasflow.model.wiki;

import com.tasflow.model.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

/**
 * One revision of a wiki page. Exactly one revision per page name is current.
 */
@Entity
@Table(name = "wiki_page",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_wiki_page_revision", columnNames = {"page_name", "revision"}),
    indexes = @Index(name = "idx_wiki_page_name_current", columnList = "page_name, is_current"))
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class WikiPage extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "page_name", nullable = false, length = 250)
    private String pageName;

    @Column(nullable = false)
    private int revision;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String markup;

    @Column(name = "revision_message", length = 500)
    private String revisionMessage;

    @Column(name = "minor_edit", nullable = false)
    private boolean minorEdit;

    @Column(name = "author_id")
    private Long authorId;

    @Column(name = "is_current", nullable = false)
    private boolean current;
}
