package com.tasflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasflow.dto.request.PublishSubmissionRequest;
import com.tasflow.dto.response.PublishSubmissionResult;
import com.tasflow.integration.VideoDescriptor;
import com.tasflow.integration.WikiPageNames;
import com.tasflow.model.enums.FailureKind;
import com.tasflow.model.enums.OutboxTaskType;
import com.tasflow.model.enums.PublicationUrlType;
import com.tasflow.model.enums.SubmissionStatus;
import com.tasflow.model.outbox.OutboxTask;
import com.tasflow.model.publication.Publication;
import com.tasflow.model.publication.PublicationUrl;
import com.tasflow.model.publication.Tag;
import com.tasflow.model.submission.Submission;
import com.tasflow.model.user.User;
import com.tasflow.repository.OutboxTaskRepository;
import com.tasflow.repository.SubmissionRepository;
import com.tasflow.repository.SubmissionStatusHistoryRepository;
import com.tasflow.service.outbox.PublishedNoticePayload;
import com.tasflow.service.outbox.RoleGrantPayload;
import com.tasflow.support.IntegrationTestBase;
import com.tasflow.support.TestFixtures;
import com.tasflow.support.TestFixtures.Catalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;

class SubmissionPublicationServiceTest extends IntegrationTestBase {

    private static final String YOUTUBE_URL = "https://www.youtube.com/watch?v=abc123";
    private static final String ARCHIVE_URL = "https://archive.org/details/encode";

    @Autowired
    private SubmissionPublicationService publicationService;

    @Autowired
    private SubmissionRepository submissionRepository;

    @Autowired
    private SubmissionStatusHistoryRepository historyRepository;

    @Autowired
    private OutboxTaskRepository outboxRepository;

    @Autowired
    private ObjectMapper objectMapper;

    private Catalog catalog;
    private User author;
    private User publisher;

    @BeforeEach
    void setup() {
        catalog = fixtures.catalog();
        author = fixtures.user("runner");
        publisher = fixtures.user("publisher");
    }

    @Test
    void publishCreatesPublicationAndFreezesSubmission() throws Exception {
        Submission submission = fixtures.submission(SubmissionStatus.PUBLICATION_UNDERWAY, author, catalog, null, publisher);
        Tag tag = fixtures.tag(TestFixtures.unique("t"));
        String fileName = TestFixtures.unique("pub-");

        PublishSubmissionResult result = publicationService.publish(request(submission.getId(), fileName)
            .selectedTags(Set.of(tag.getId()))
            .build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.publicationTitle()).isEqualTo("[" + result.publicationId() + "] "
            + catalog.system().getCode() + " " + catalog.game().getDisplayName()
            + " \"100%\" by " + author.getUserName() + " in 01:00.00");

        Publication publication = publicationRepository.findByIdWithSyncDetails(result.publicationId()).orElseThrow();
        assertThat(publication.getMovieFileName()).isEqualTo(fileName + ".fm2");
        assertThat(publication.authorIds()).containsExactly(author.getId());
        assertThat(publication.getUrls())
            .extracting(PublicationUrl::getType, PublicationUrl::getUrl)
            .containsExactlyInAnyOrder(
                tuple(PublicationUrlType.STREAMING, YOUTUBE_URL),
                tuple(PublicationUrlType.STREAMING, ARCHIVE_URL),
                tuple(PublicationUrlType.MIRROR, "https://mirror.example/run.zip"));
        assertThat(publicationRepository.findTagIdsById(result.publicationId())).containsExactly(tag.getId());

        assertThat(submissionRepository.findStatusById(submission.getId())).contains(SubmissionStatus.PUBLISHED);
        assertThat(historyRepository.findBySubmissionIdOrderByIdAsc(submission.getId()))
            .singleElement()
            .satisfies(h -> assertThat(h.getNewStatus()).isEqualTo(SubmissionStatus.PUBLISHED));
        assertThat(wikiPages.page(WikiPageNames.publication(result.publicationId())).orElseThrow().getMarkup())
            .isEqualTo("A fast run.");

        List<VideoDescriptor> syncs = payloadsOf(OutboxTaskType.VIDEO_SYNC, VideoDescriptor.class).stream()
            .filter(v -> v.publicationId().equals(result.publicationId()))
            .toList();
        assertThat(syncs).singleElement().satisfies(v -> {
            assertThat(v.url()).isEqualTo(YOUTUBE_URL);
            assertThat(v.obsoletedBy()).isNull();
            assertThat(v.authors()).containsExactly(author.getUserName());
        });
        assertThat(payloadsOf(OutboxTaskType.GRANT_PUBLICATION_ROLES, RoleGrantPayload.class))
            .anySatisfy(p -> assertThat(p.publicationTitle()).isEqualTo(result.publicationTitle()));
        assertThat(payloadsOf(OutboxTaskType.NOTIFY_PUBLISHED, PublishedNoticePayload.class))
            .contains(new PublishedNoticePayload(submission.getId(), result.publicationId()));
    }

    @Test
    void duplicateFileNameLeavesNoNewRows() {
        Submission first = fixtures.submission(SubmissionStatus.PUBLICATION_UNDERWAY, author, catalog, null, publisher);
        Submission second = fixtures.submission(SubmissionStatus.PUBLICATION_UNDERWAY, author, catalog, null, publisher);
        String fileName = TestFixtures.unique("dup-");
        assertThat(publicationService.publish(request(first.getId(), fileName).build()).isSuccess()).isTrue();
        long publications = publicationRepository.count();
        long tasks = outboxRepository.count();

        PublishSubmissionResult result = publicationService.publish(request(second.getId(), fileName).build());

        assertThat(result.failureKind()).isEqualTo(FailureKind.PRECONDITION_FAILED);
        assertThat(result.errorMessage()).contains(fileName + ".fm2");
        assertThat(publicationRepository.count()).isEqualTo(publications);
        assertThat(outboxRepository.count()).isEqualTo(tasks);
        assertThat(submissionRepository.findStatusById(second.getId())).contains(SubmissionStatus.PUBLICATION_UNDERWAY);
    }

    @Test
    void losingTheFileNameRaceIsReportedAsPrecondition() {
        Submission first = fixtures.submission(SubmissionStatus.PUBLICATION_UNDERWAY, author, catalog, null, publisher);
        Submission second = fixtures.submission(SubmissionStatus.PUBLICATION_UNDERWAY, author, catalog, null, publisher);
        String fileName = TestFixtures.unique("race-");
        assertThat(publicationService.publish(request(first.getId(), fileName).build()).isSuccess()).isTrue();
        long publications = publicationRepository.count();
        // the second publisher checks before the first one's row is visible
        doReturn(false).doCallRealMethod().when(publicationRepository).existsByMovieFileName(fileName + ".fm2");

        PublishSubmissionResult result = publicationService.publish(request(second.getId(), fileName).build());

        assertThat(result.failureKind()).isEqualTo(FailureKind.PRECONDITION_FAILED);
        assertThat(result.errorMessage()).isEqualTo("Movie filename " + fileName + ".fm2 already exists");
        assertThat(publicationRepository.count()).isEqualTo(publications);
        assertThat(submissionRepository.findStatusById(second.getId())).contains(SubmissionStatus.PUBLICATION_UNDERWAY);
        assertThat(historyRepository.countBySubmissionId(second.getId())).isZero();
    }

    @Test
    void wikiFailureRollsBackEverything() {
        Submission submission = fixtures.submission(SubmissionStatus.PUBLICATION_UNDERWAY, author, catalog, null, publisher);
        String fileName = TestFixtures.unique("wiki-");
        doThrow(new IllegalStateException("wiki store unavailable"))
            .when(wikiPages).add(argThat(r -> r != null && r.pageName().startsWith(WikiPageNames.PUBLICATION_PREFIX)));
        long tasks = outboxRepository.count();

        PublishSubmissionResult result = publicationService.publish(request(submission.getId(), fileName).build());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.failureKind()).isEqualTo(FailureKind.UNEXPECTED);
        assertThat(result.errorMessage()).contains("wiki store unavailable");
        assertThat(publicationRepository.existsByMovieFileName(fileName + ".fm2")).isFalse();
        assertThat(submissionRepository.findStatusById(submission.getId())).contains(SubmissionStatus.PUBLICATION_UNDERWAY);
        assertThat(historyRepository.countBySubmissionId(submission.getId())).isZero();
        assertThat(outboxRepository.count()).isEqualTo(tasks);
    }

    @Test
    void submissionMustBeUnderPublication() {
        Submission accepted = fixtures.submission(SubmissionStatus.ACCEPTED, author, catalog, null, null);

        PublishSubmissionResult result = publicationService.publish(request(accepted.getId(), TestFixtures.unique("acc-")).build());

        assertThat(result.failureKind()).isEqualTo(FailureKind.PRECONDITION_FAILED);
    }

    @Test
    void missingSubmissionIsNotFound() {
        PublishSubmissionResult result = publicationService.publish(request(Long.MAX_VALUE, TestFixtures.unique("none-")).build());

        assertThat(result.failureKind()).isEqualTo(FailureKind.NOT_FOUND);
    }

    @Test
    void invalidRequestIsRejectedBeforeAnyWork() {
        PublishSubmissionResult result = publicationService.publish(request(1L, "bad name!").onlineWatchingUrl(" ").build());

        assertThat(result.failureKind()).isEqualTo(FailureKind.VALIDATION_FAILED);
        assertThat(result.errorMessage()).contains("movieFilename", "onlineWatchingUrl");
    }

    @Test
    void missingObsoletionTargetIsNotFound() {
        Submission submission = fixtures.submission(SubmissionStatus.PUBLICATION_UNDERWAY, author, catalog, null, publisher);
        String fileName = TestFixtures.unique("obs-");

        PublishSubmissionResult result = publicationService.publish(request(submission.getId(), fileName)
            .movieToObsolete(Long.MAX_VALUE)
            .build());

        assertThat(result.failureKind()).isEqualTo(FailureKind.NOT_FOUND);
        assertThat(publicationRepository.existsByMovieFileName(fileName + ".fm2")).isFalse();
    }

    @Test
    void publishObsoletesPreviousPublicationInline() throws Exception {
        Publication previous = fixtures.publication(catalog, author, List.of("https://youtu.be/old1"), Set.of());
        Submission submission = fixtures.submission(SubmissionStatus.PUBLICATION_UNDERWAY, author, catalog, null, publisher);

        PublishSubmissionResult result = publicationService.publish(request(submission.getId(), TestFixtures.unique("new-"))
            .movieToObsolete(previous.getId())
            .build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(publicationRepository.findObsoletedById(previous.getId())).contains(result.publicationId());
        assertThat(payloadsOf(OutboxTaskType.VIDEO_SYNC, VideoDescriptor.class))
            .anySatisfy(v -> {
                assertThat(v.publicationId()).isEqualTo(previous.getId());
                assertThat(v.url()).isEqualTo("https://youtu.be/old1");
                assertThat(v.obsoletedBy()).isEqualTo(result.publicationId());
            });
    }

    private PublishSubmissionRequest.PublishSubmissionRequestBuilder request(Long submissionId, String fileName) {
        return PublishSubmissionRequest.builder()
            .submissionId(submissionId)
            .userId(publisher.getId())
            .movieFilename(fileName)
            .movieExtension("fm2")
            .onlineWatchingUrl(YOUTUBE_URL)
            .alternateOnlineWatchingUrl(ARCHIVE_URL)
            .alternateOnlineWatchUrlName("Archive")
            .mirrorSiteUrl("https://mirror.example/run.zip")
            .movieDescription("A fast run.");
    }

    private <T> List<T> payloadsOf(OutboxTaskType type, Class<T> payloadType) throws Exception {
        List<T> payloads = new ArrayList<>();
        for (OutboxTask task : outboxRepository.findByTypeOrderByIdAsc(type)) {
            payloads.add(objectMapper.readValue(task.getPayload(), payloadType));
        }
        return payloads;
    }
}
