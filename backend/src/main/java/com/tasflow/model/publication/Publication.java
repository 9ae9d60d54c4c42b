package com.tasflow.model.publication;

import com.tasflow.helper.MovieTitles;
import com.tasflow.model.AuditableEntity;
import com.tasflow.model.enums.PublicationUrlType;
import com.tasflow.model.file.MovieFile;
import com.tasflow.model.game.Game;
import com.tasflow.model.game.GameGoal;
import com.tasflow.model.game.GameSystem;
import com.tasflow.model.game.GameSystemFrameRate;
import com.tasflow.model.game.GameVersion;
import com.tasflow.model.submission.Submission;
import com.tasflow.model.submission.SubmissionAuthor;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.util.*;

/**
 * A published movie. Publications are never deleted; a newer publication of the
 * same game may mark one as obsolete through {@link #obsoletedById}.
 */
@Entity
@Table(name = "publication", indexes = {
    @Index(name = "idx_publication_game", columnList = "game_id"),
    @Index(name = "idx_publication_obsoleted_by", columnList = "obsoleted_by_id"),
    @Index(name = "idx_publication_movie_file_name", columnList = "movie_file_name", unique = true)
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class Publication extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 500)
    private String title;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "submission_id", nullable = false, updatable = false)
    private Submission submission;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "publication_class_id", nullable = false)
    private PublicationClass publicationClass;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "system_id", nullable = false)
    private GameSystem system;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "system_frame_rate_id", nullable = false)
    private GameSystemFrameRate systemFrameRate;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "game_id", nullable = false)
    private Game game;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "game_version_id", nullable = false)
    private GameVersion gameVersion;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "game_goal_id")
    private GameGoal gameGoal;

    @Column(name = "emulator_version", length = 255)
    private String emulatorVersion;

    @Column(nullable = false)
    private int frames;

    @Column(name = "rerecord_count", nullable = false)
    private int rerecordCount;

    @Column(name = "movie_file_name", nullable = false, length = 255)
    private String movieFileName;

    @Column(name = "additional_authors", length = 500)
    private String additionalAuthors;

    @OneToOne(cascade = CascadeType.ALL, fetch = FetchType.LAZY)
    @JoinColumn(name = "movie_file_id", nullable = false)
    private MovieFile movieFile;

    /**
     * Publication that supersedes this one, always of the same game.
     */
    @Column(name = "obsoleted_by_id")
    private Long obsoletedById;

    @OneToMany(mappedBy = "publication", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("ordinal")
    @Builder.Default
    private List<PublicationAuthor> authors = new ArrayList<>();

    @OneToMany(mappedBy = "publication", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("id")
    @Builder.Default
    private Set<PublicationUrl> urls = new LinkedHashSet<>();

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(name = "publication_flag",
        joinColumns = @JoinColumn(name = "publication_id"),
        inverseJoinColumns = @JoinColumn(name = "flag_id"))
    @Builder.Default
    private Set<Flag> flags = new HashSet<>();

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(name = "publication_tag",
        joinColumns = @JoinColumn(name = "publication_id"),
        inverseJoinColumns = @JoinColumn(name = "tag_id"))
    @Builder.Default
    private Set<Tag> tags = new HashSet<>();

    public void addStreamingUrl(String url, String displayName) {
        addUrl(url, displayName, PublicationUrlType.STREAMING);
    }

    public void addMirrorUrl(String url) {
        addUrl(url, null, PublicationUrlType.MIRROR);
    }

    public List<PublicationUrl> streamingUrls() {
        return urls.stream()
            .filter(u -> u.getType() == PublicationUrlType.STREAMING)
            .toList();
    }

    /**
     * Copies the submission's authors, preserving their ordinals.
     */
    public void copyAuthorsFrom(Collection<SubmissionAuthor> submissionAuthors) {
        submissionAuthors.stream()
            .sorted(Comparator.comparingInt(SubmissionAuthor::getOrdinal))
            .forEach(sa -> authors.add(PublicationAuthor.builder()
                .publication(this)
                .author(sa.getAuthor())
                .ordinal(sa.getOrdinal())
                .build()));
    }

    public List<String> authorNames() {
        return authors.stream()
            .sorted(Comparator.comparingInt(PublicationAuthor::getOrdinal))
            .map(pa -> pa.getAuthor().getUserName())
            .toList();
    }

    public List<Long> authorIds() {
        return authors.stream()
            .sorted(Comparator.comparingInt(PublicationAuthor::getOrdinal))
            .map(pa -> pa.getAuthor().getId())
            .toList();
    }

    /**
     * Title in the form {@code [42] SYS Game "goal" by Author in 12:34.56}.
     * Requires the id, so it is generated after the first save.
     */
    public void generateTitle() {
        String goal = gameGoal != null && !"baseline".equalsIgnoreCase(gameGoal.getDisplayName())
            ? gameGoal.getDisplayName()
            : null;

        title = "[" + id + "] "
            + system.getCode() + " "
            + game.getDisplayName()
            + MovieTitles.goalSuffix(goal)
            + " by " + MovieTitles.joinAuthors(authorNames(), additionalAuthors)
            + " in " + MovieTitles.formatTime(frames, systemFrameRate.getFrameRate());
    }

    private void addUrl(String url, String displayName, PublicationUrlType type) {
        if (url == null || url.isBlank()) {
            return;
        }
        urls.add(PublicationUrl.builder()
            .publication(this)
            .url(url.trim())
            .displayName(displayName)
            .type(type)
            .build());
    }
}
