package com.tasflow.support;

import com.tasflow.integration.WikiCreateRequest;
import com.tasflow.integration.WikiPageNames;
import com.tasflow.integration.WikiPages;
import com.tasflow.model.enums.SubmissionStatus;
import com.tasflow.model.file.MovieFile;
import com.tasflow.model.forum.ForumTopic;
import com.tasflow.model.game.Game;
import com.tasflow.model.game.GameGoal;
import com.tasflow.model.game.GameSystem;
import com.tasflow.model.game.GameSystemFrameRate;
import com.tasflow.model.game.GameVersion;
import com.tasflow.model.publication.Flag;
import com.tasflow.model.publication.Publication;
import com.tasflow.model.publication.PublicationClass;
import com.tasflow.model.publication.Tag;
import com.tasflow.model.submission.Submission;
import com.tasflow.model.user.User;
import com.tasflow.repository.FlagRepository;
import com.tasflow.repository.ForumTopicRepository;
import com.tasflow.repository.GameGoalRepository;
import com.tasflow.repository.GameRepository;
import com.tasflow.repository.GameSystemFrameRateRepository;
import com.tasflow.repository.GameSystemRepository;
import com.tasflow.repository.GameVersionRepository;
import com.tasflow.repository.PublicationClassRepository;
import com.tasflow.repository.PublicationRepository;
import com.tasflow.repository.SubmissionRepository;
import com.tasflow.repository.TagRepository;
import com.tasflow.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds persisted test data. Every name is unique so tests can share one database.
 */
@Component
@RequiredArgsConstructor
public class TestFixtures {

    public static final int WORKBENCH_FORUM_ID = 7;
    public static final byte[] MOVIE_BYTES = {'P', 'K', 3, 4, 1, 2, 3};

    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private final UserRepository userRepository;
    private final GameSystemRepository systemRepository;
    private final GameSystemFrameRateRepository frameRateRepository;
    private final GameRepository gameRepository;
    private final GameVersionRepository versionRepository;
    private final GameGoalRepository goalRepository;
    private final PublicationClassRepository classRepository;
    private final FlagRepository flagRepository;
    private final TagRepository tagRepository;
    private final SubmissionRepository submissionRepository;
    private final PublicationRepository publicationRepository;
    private final ForumTopicRepository topicRepository;
    private final WikiPages wikiPages;

    public record Catalog(
        GameSystem system,
        GameSystemFrameRate frameRate,
        Game game,
        GameVersion version,
        GameGoal goal,
        PublicationClass publicationClass
    ) {}

    public static int next() {
        return SEQUENCE.incrementAndGet();
    }

    public static String unique(String prefix) {
        return prefix + next();
    }

    public static Instant longAgo() {
        return Instant.now().minus(Duration.ofDays(30));
    }

    @Transactional
    public User user(String prefix, String... roles) {
        return userRepository.save(User.builder()
            .userName(unique(prefix))
            .roles(new HashSet<>(Set.of(roles)))
            .build());
    }

    @Transactional
    public Catalog catalog() {
        int n = next();
        GameSystem system = systemRepository.save(GameSystem.builder().code("SYS" + n).displayName("System " + n).build());
        GameSystemFrameRate rate = frameRateRepository.save(GameSystemFrameRate.builder()
            .system(system).frameRate(60.0).regionCode("NTSC").build());
        Game game = gameRepository.save(Game.builder().displayName("Game " + n).abbreviation("g" + n).build());
        GameVersion version = versionRepository.save(GameVersion.builder().game(game).name("Rev " + n).region("U").build());
        GameGoal goal = goalRepository.save(GameGoal.builder().game(game).displayName("100%").build());
        PublicationClass publicationClass = classRepository.save(PublicationClass.builder().name("Standard").build());
        return new Catalog(system, rate, game, version, goal, publicationClass);
    }

    @Transactional
    public Flag flag(String name) {
        return flagRepository.save(Flag.builder().name(name).build());
    }

    @Transactional
    public Tag tag(String code) {
        return tagRepository.save(Tag.builder().code(code).displayName(code).build());
    }

    /**
     * Submission authored by its submitter, old enough to be judged, with topic and wiki page.
     */
    @Transactional
    public Submission submission(SubmissionStatus status, User submitter, Catalog catalog, User judge, User publisher) {
        Submission submission = submissionRepository.saveAndFlush(Submission.builder()
            .status(status)
            .submitter(submitter)
            .judge(judge)
            .publisher(publisher)
            .gameName(catalog.game().getDisplayName())
            .game(catalog.game())
            .gameVersion(catalog.version())
            .gameGoal(catalog.goal())
            .intendedClass(catalog.publicationClass())
            .system(catalog.system())
            .systemFrameRate(catalog.frameRate())
            .emulatorVersion("FCEUX 2.6.6")
            .frames(3600)
            .rerecordCount(1200)
            .movieExtension("fm2")
            .movieFile(MOVIE_BYTES.clone())
            .createdAt(longAgo())
            .build());

        submission.replaceAuthors(List.of(submitter));
        submission.generateTitle();

        ForumTopic topic = topicRepository.save(ForumTopic.builder()
            .forumId((long) WORKBENCH_FORUM_ID)
            .title(submission.getTitle())
            .submissionId(submission.getId())
            .build());
        submission.setTopicId(topic.getId());

        wikiPages.add(new WikiCreateRequest(
            WikiPageNames.submission(submission.getId()), "Submission notes", submitter.getId(), "Initial"));
        return submissionRepository.save(submission);
    }

    /**
     * Publication of a published submission by {@code author}, with the given streaming urls.
     */
    @Transactional
    public Publication publication(Catalog catalog, User author, List<String> streamingUrls, Set<Tag> tags) {
        Submission submission = submission(SubmissionStatus.PUBLISHED, author, catalog, null, null);
        String fileName = unique("movie-") + ".fm2";

        Publication publication = Publication.builder()
            .submission(submission)
            .publicationClass(catalog.publicationClass())
            .system(catalog.system())
            .systemFrameRate(catalog.frameRate())
            .game(catalog.game())
            .gameVersion(catalog.version())
            .gameGoal(catalog.goal())
            .frames(3600)
            .rerecordCount(1200)
            .movieFileName(fileName)
            .movieFile(MovieFile.builder().fileName(fileName).fileData(MOVIE_BYTES.clone()).originalLength(MOVIE_BYTES.length).build())
            .tags(new HashSet<>(tags))
            .build();
        streamingUrls.forEach(url -> publication.addStreamingUrl(url, null));
        publication.copyAuthorsFrom(submission.getAuthors());

        publicationRepository.saveAndFlush(publication);
        publication.generateTitle();

        wikiPages.add(new WikiCreateRequest(
            WikiPageNames.publication(publication.getId()), "Publication notes", author.getId(), "Initial"));
        return publicationRepository.save(publication);
    }
}
