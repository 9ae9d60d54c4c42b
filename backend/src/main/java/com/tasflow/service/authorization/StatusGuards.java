package com.tasflow.service.authorization;

import com.tasflow.model.enums.SubmissionStatus;

import java.util.EnumSet;
import java.util.Set;

import static com.tasflow.model.enums.SubmissionStatus.*;

/**
 * The status transition rules for actors without the override permission.
 */
public enum StatusGuards implements StatusGuard {

    /**
     * Leaving the status unchanged is always legal.
     */
    CURRENT {
        @Override
        public Set<SubmissionStatus> offer(StatusContext c) {
            return EnumSet.of(c.currentStatus());
        }
    },

    /**
     * Judges may send a submission back to New once the window is open;
     * authors may reopen their own cancelled submission.
     */
    BACK_TO_NEW {
        private final Set<SubmissionStatus> judgeReopenable = EnumSet.of(
            JUDGING_UNDERWAY, DELAYED, NEEDS_MORE_INFO, ACCEPTED, PUBLICATION_UNDERWAY,
            REJECTED, CANCELLED, PLAYGROUND);

        @Override
        public Set<SubmissionStatus> offer(StatusContext c) {
            if (c.judgeAfterWindow() && c.isIn(judgeReopenable)) {
                return EnumSet.of(NEW);
            }
            if (c.authorOrSubmitter() && c.currentStatus() == CANCELLED) {
                return EnumSet.of(NEW);
            }
            return EnumSet.noneOf(SubmissionStatus.class);
        }
    },

    CLAIM_FOR_JUDGING {
        @Override
        public Set<SubmissionStatus> offer(StatusContext c) {
            return c.canJudge() && !c.authorOrSubmitter() && c.currentStatus() != PUBLISHED
                ? EnumSet.of(JUDGING_UNDERWAY)
                : EnumSet.noneOf(SubmissionStatus.class);
        }
    },

    JUDGE_DEFERRAL {
        private final Set<SubmissionStatus> from = EnumSet.of(
            JUDGING_UNDERWAY, DELAYED, NEEDS_MORE_INFO, ACCEPTED, PUBLICATION_UNDERWAY);

        @Override
        public Set<SubmissionStatus> offer(StatusContext c) {
            return c.judgeAfterWindow() && c.isIn(from)
                ? EnumSet.of(JUDGING_UNDERWAY, DELAYED, NEEDS_MORE_INFO)
                : EnumSet.noneOf(SubmissionStatus.class);
        }
    },

    /**
     * Accept or reject. An accepted submission can still be rejected.
     */
    VERDICT {
        private final Set<SubmissionStatus> undecided = EnumSet.of(
            JUDGING_UNDERWAY, DELAYED, NEEDS_MORE_INFO, PUBLICATION_UNDERWAY);

        @Override
        public Set<SubmissionStatus> offer(StatusContext c) {
            if (!c.judgeAfterWindow()) {
                return EnumSet.noneOf(SubmissionStatus.class);
            }
            if (c.isIn(undecided)) {
                return EnumSet.of(ACCEPTED, REJECTED);
            }
            return c.currentStatus() == ACCEPTED
                ? EnumSet.of(REJECTED)
                : EnumSet.noneOf(SubmissionStatus.class);
        }
    },

    PUBLICATION_HANDOFF {
        @Override
        public Set<SubmissionStatus> offer(StatusContext c) {
            if (c.currentStatus() == ACCEPTED && c.canPublish()) {
                return EnumSet.of(PUBLICATION_UNDERWAY);
            }
            if (c.currentStatus() == PUBLICATION_UNDERWAY && c.publisher()) {
                return EnumSet.of(ACCEPTED);
            }
            return EnumSet.noneOf(SubmissionStatus.class);
        }
    },

    CANCEL {
        @Override
        public Set<SubmissionStatus> offer(StatusContext c) {
            return (c.judge() || c.authorOrSubmitter()) && c.currentStatus().isWorkInProgress()
                ? EnumSet.of(CANCELLED)
                : EnumSet.noneOf(SubmissionStatus.class);
        }
    },

    PLAYGROUND_MOVE {
        private final Set<SubmissionStatus> from = EnumSet.of(JUDGING_UNDERWAY, DELAYED, NEEDS_MORE_INFO);

        @Override
        public Set<SubmissionStatus> offer(StatusContext c) {
            return c.judgeAfterWindow() && c.isIn(from)
                ? EnumSet.of(PLAYGROUND)
                : EnumSet.noneOf(SubmissionStatus.class);
        }
    }
}
