package com.tasflow.model.submission;

import com.tasflow.helper.MovieTitles;
import com.tasflow.model.AuditableEntity;
import com.tasflow.model.enums.SubmissionStatus;
import com.tasflow.model.game.Game;
import com.tasflow.model.game.GameGoal;
import com.tasflow.model.game.GameSystem;
import com.tasflow.model.game.GameSystemFrameRate;
import com.tasflow.model.game.GameVersion;
import com.tasflow.model.publication.PublicationClass;
import com.tasflow.model.user.User;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A candidate movie moving through judging and publication.
 *
 * The judge and publisher references double as the claim state: at most one of each at a time.
 * Once the status is {@link SubmissionStatus#PUBLISHED} the record is frozen and further edits
 * go to the derived publication.
 */
@Entity
@Table(name = "submission", indexes = {
    @Index(name = "idx_submission_status", columnList = "status"),
    @Index(name = "idx_submission_submitter", columnList = "submitter_id")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class Submission extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Write token. Every status write is conditional on the token it was read with.
     */
    @Version
    @Column(nullable = false)
    @Builder.Default
    private Long version = 0L;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    @Builder.Default
    private SubmissionStatus status = SubmissionStatus.NEW;

    @Column(length = 500)
    private String title;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "submitter_id", nullable = false)
    private User submitter;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "judge_id")
    private User judge;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "publisher_id")
    private User publisher;

    // Catalog references, assigned by judges once the game is identified
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "game_id")
    private Game game;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "game_version_id")
    private GameVersion gameVersion;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "game_goal_id")
    private GameGoal gameGoal;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "intended_class_id")
    private PublicationClass intendedClass;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "rejection_reason_id")
    private RejectionReason rejectionReason;

    @Column(name = "topic_id")
    private Long topicId;

    // Submitter supplied game information
    @Column(name = "game_name", length = 250)
    private String gameName;

    @Column(name = "submitted_game_version", length = 250)
    private String submittedGameVersion;

    @Column(length = 50)
    private String branch;

    @Column(name = "rom_name", length = 250)
    private String romName;

    @Column(name = "emulator_version", length = 255)
    private String emulatorVersion;

    @Column(name = "encode_embed_link", length = 500)
    private String encodeEmbedLink;

    @Column(name = "additional_authors", length = 500)
    private String additionalAuthors;

    // Movie metadata
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "system_id")
    private GameSystem system;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "system_frame_rate_id")
    private GameSystemFrameRate systemFrameRate;

    @Column(nullable = false)
    private int frames;

    @Column(name = "rerecord_count", nullable = false)
    private int rerecordCount;

    @Column(name = "movie_extension", length = 20)
    private String movieExtension;

    @Column(name = "hash_type", length = 20)
    private String hashType;

    @Column(length = 128)
    private String hash;

    @Column(columnDefinition = "TEXT")
    private String annotations;

    @Column(length = 500)
    private String warnings;

    @Lob
    @Basic(fetch = FetchType.LAZY)
    @Column(name = "movie_file")
    private byte[] movieFile;

    @OneToMany(mappedBy = "submission", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("ordinal")
    @Builder.Default
    private List<SubmissionAuthor> authors = new ArrayList<>();

    public boolean canPublish() {
        return status == SubmissionStatus.PUBLICATION_UNDERWAY;
    }

    public boolean isAuthorOrSubmitter(Long userId) {
        if (userId == null) {
            return false;
        }
        if (submitter != null && userId.equals(submitter.getId())) {
            return true;
        }
        return authors.stream()
            .anyMatch(a -> a.getAuthor() != null && userId.equals(a.getAuthor().getId()));
    }

    public boolean isJudgedBy(Long userId) {
        return judge != null && Objects.equals(judge.getId(), userId);
    }

    public boolean isPublishedBy(Long userId) {
        return publisher != null && Objects.equals(publisher.getId(), userId);
    }

    /**
     * Replaces the author list, keeping the given order as ordinals.
     */
    public void replaceAuthors(List<User> users) {
        authors.clear();
        int ordinal = 0;
        for (User user : users) {
            authors.add(SubmissionAuthor.builder()
                .submission(this)
                .author(user)
                .ordinal(ordinal++)
                .build());
        }
    }

    /**
     * Title in the form {@code #123: Author's SYS Game "goal" in 12:34.56}.
     * Requires the id, so it is generated after the first save.
     */
    public void generateTitle() {
        List<String> names = authors.stream()
            .map(a -> a.getAuthor().getUserName())
            .toList();
        String gameTitle = game != null ? game.getDisplayName() : gameName;
        String goal = gameGoal != null && !"baseline".equalsIgnoreCase(gameGoal.getDisplayName())
            ? gameGoal.getDisplayName()
            : branch;
        Double frameRate = systemFrameRate != null ? systemFrameRate.getFrameRate() : null;

        title = "#" + id + ": "
            + MovieTitles.joinAuthors(names, additionalAuthors) + "'s "
            + (system != null ? system.getCode() : "Unknown") + " "
            + gameTitle
            + MovieTitles.goalSuffix(goal)
            + " in " + MovieTitles.formatTime(frames, frameRate);
    }
}
