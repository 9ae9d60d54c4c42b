package com.tasflow.service.authorization;

import com.tasflow.model.enums.PermissionTo;
import com.tasflow.model.enums.SubmissionStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.Set;

import static com.tasflow.model.enums.SubmissionStatus.*;
import static org.assertj.core.api.Assertions.assertThat;

class SubmissionAuthorizationServiceTest {

    private static final int WINDOW_HOURS = 72;
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final Instant LONG_AGO = NOW.minus(Duration.ofDays(30));
    private static final Instant JUST_NOW = NOW.minus(Duration.ofHours(WINDOW_HOURS - 1));

    private static final Set<PermissionTo> JUDGE = EnumSet.of(PermissionTo.JUDGE_SUBMISSIONS);
    private static final Set<PermissionTo> PUBLISHER = EnumSet.of(PermissionTo.PUBLISH_MOVIES);
    private static final Set<PermissionTo> OVERRIDE = EnumSet.of(PermissionTo.OVERRIDE_SUBMISSION_CONSTRAINTS);
    private static final Set<PermissionTo> NONE = EnumSet.noneOf(PermissionTo.class);

    private final SubmissionAuthorizationService service =
        new SubmissionAuthorizationService(Clock.fixed(NOW, ZoneOffset.UTC), WINDOW_HOURS);

    @Test
    void publishedOffersOnlyPublishedEvenWithOverride() {
        assertThat(service.availableStatuses(PUBLISHED, OVERRIDE, LONG_AGO, true, true, true))
            .containsExactly(PUBLISHED);
        assertThat(service.availableStatuses(PUBLISHED, JUDGE, LONG_AGO, false, true, false))
            .containsExactly(PUBLISHED);
    }

    @Test
    void overrideOffersEverythingButPublished() {
        Set<SubmissionStatus> available = service.availableStatuses(NEW, OVERRIDE, JUST_NOW, false, false, false);

        assertThat(available).doesNotContain(PUBLISHED);
        assertThat(available).hasSize(SubmissionStatus.values().length - 1);
    }

    @ParameterizedTest
    @EnumSource(value = SubmissionStatus.class, names = "PUBLISHED", mode = EnumSource.Mode.EXCLUDE)
    void currentStatusIsAlwaysAvailable(SubmissionStatus current) {
        assertThat(service.availableStatuses(current, NONE, JUST_NOW, false, false, false)).contains(current);
        assertThat(service.availableStatuses(current, JUDGE, LONG_AGO, false, true, false)).contains(current);
        assertThat(service.availableStatuses(current, PUBLISHER, LONG_AGO, true, false, true)).contains(current);
    }

    @Test
    void sameInputsGiveSameResult() {
        Set<SubmissionStatus> first = service.availableStatuses(JUDGING_UNDERWAY, JUDGE, LONG_AGO, false, true, false);
        Set<SubmissionStatus> second = service.availableStatuses(JUDGING_UNDERWAY, JUDGE, LONG_AGO, false, true, false);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void publisherCanTakeAcceptedSubmission() {
        Set<SubmissionStatus> available = service.availableStatuses(ACCEPTED, PUBLISHER, LONG_AGO, false, false, false);

        assertThat(available).contains(PUBLICATION_UNDERWAY, ACCEPTED).doesNotContain(PUBLISHED);
    }

    @Test
    void claimingPublisherCanHandBack() {
        assertThat(service.availableStatuses(PUBLICATION_UNDERWAY, PUBLISHER, LONG_AGO, false, false, true))
            .contains(ACCEPTED);
        assertThat(service.availableStatuses(PUBLICATION_UNDERWAY, PUBLISHER, LONG_AGO, false, false, false))
            .doesNotContain(ACCEPTED);
    }

    @Test
    void noVerdictBeforeJudgingWindow() {
        Set<SubmissionStatus> available = service.availableStatuses(JUDGING_UNDERWAY, JUDGE, JUST_NOW, false, true, false);

        assertThat(available).doesNotContain(ACCEPTED, REJECTED, DELAYED, NEEDS_MORE_INFO, NEW, PLAYGROUND);
        assertThat(available).contains(JUDGING_UNDERWAY, CANCELLED);
        assertThat(service.hoursRemainingForJudging(JUDGING_UNDERWAY, JUST_NOW)).isEqualTo(1);
    }

    @Test
    void claimingJudgeAfterWindowGetsVerdicts() {
        Set<SubmissionStatus> available = service.availableStatuses(JUDGING_UNDERWAY, JUDGE, LONG_AGO, false, true, false);

        assertThat(available).containsExactlyInAnyOrder(
            NEW, JUDGING_UNDERWAY, DELAYED, NEEDS_MORE_INFO, ACCEPTED, REJECTED, CANCELLED, PLAYGROUND);
    }

    @Test
    void unclaimedJudgeCanOnlyClaim() {
        Set<SubmissionStatus> available = service.availableStatuses(NEW, JUDGE, LONG_AGO, false, false, false);

        assertThat(available).containsExactlyInAnyOrder(NEW, JUDGING_UNDERWAY);
    }

    @Test
    void judgeCannotClaimOwnSubmission() {
        Set<SubmissionStatus> available = service.availableStatuses(NEW, JUDGE, LONG_AGO, true, false, false);

        assertThat(available).containsExactlyInAnyOrder(NEW, CANCELLED);
    }

    @Test
    void authorCanCancelAndReopen() {
        assertThat(service.availableStatuses(DELAYED, NONE, JUST_NOW, true, false, false))
            .containsExactlyInAnyOrder(DELAYED, CANCELLED);
        assertThat(service.availableStatuses(CANCELLED, NONE, JUST_NOW, true, false, false))
            .containsExactlyInAnyOrder(CANCELLED, NEW);
    }

    @Test
    void bystanderCanOnlyKeepStatus() {
        assertThat(service.availableStatuses(NEW, NONE, LONG_AGO, false, false, false)).containsExactly(NEW);
    }

    @Test
    void hoursRemainingIsZeroOnceWindowPassed() {
        assertThat(service.hoursRemainingForJudging(NEW, LONG_AGO)).isZero();
        assertThat(service.hoursRemainingForJudging(NEW, NOW)).isEqualTo(WINDOW_HOURS);
    }

    @Test
    void hoursRemainingIsZeroWhenStatusCanNoLongerBeJudged() {
        assertThat(service.hoursRemainingForJudging(ACCEPTED, JUST_NOW)).isZero();
        assertThat(service.hoursRemainingForJudging(CANCELLED, NOW)).isZero();
    }

    @Test
    void windowOpensExactlyAtMinimumHours() {
        assertThat(service.isJudgingWindowOpen(NOW.minus(Duration.ofHours(WINDOW_HOURS)))).isTrue();
        assertThat(service.isJudgingWindowOpen(NOW.minus(Duration.ofHours(WINDOW_HOURS)).plusSeconds(1))).isFalse();
    }
}
