package com.codesmith.orchestrator.model;

import com.codesmith.orchestrator.TestClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;

import static com.codesmith.orchestrator.model.AttemptHistoryTest.attempt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobTest {

    private final TestClock clock = new TestClock();

    // ------------------------------------------------------------------
    // Construction
    // ------------------------------------------------------------------

    @Test
    void newJob_isPendingOnCheapestTier() {
        Job job = newJob(5);

        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getCurrentTier()).isEqualTo(Tier.LOCAL);
        assertThat(job.getCreatedAt()).isEqualTo(clock.instant());
        assertThat(job.getResult()).isEmpty();
        assertThat(job.existingConversation()).isEmpty();
    }

    @Test
    void newJob_blankTask_throws() {
        assertThatThrownBy(() -> new Job(UUID.randomUUID(), "  ", "java", 3, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void newJob_zeroIterations_throws() {
        assertThatThrownBy(() -> new Job(UUID.randomUUID(), "task", "java", 0, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // State transitions
    // ------------------------------------------------------------------

    @Test
    void markRunning_fromPending_setsStartedAt() {
        Job job = newJob(5);
        clock.advance(Duration.ofSeconds(3));

        assertThat(job.markRunning()).isTrue();
        assertThat(job.getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(job.getStartedAt()).isEqualTo(clock.instant());
    }

    @Test
    void markRunning_twice_secondCallFails() {
        Job job = newJob(5);
        job.markRunning();
        assertThat(job.markRunning()).isFalse();
    }

    @Test
    void finish_onlyFirstTerminalTransitionWins() {
        Job job = newJob(5);
        job.markRunning();

        assertThat(job.finish(JobResult.of(TerminalReason.ACCEPTED_HIGH_SCORE, null))).isTrue();
        assertThat(job.finish(JobResult.of(TerminalReason.CANCELLED, null))).isFalse();

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getResult()).map(JobResult::reason).contains(TerminalReason.ACCEPTED_HIGH_SCORE);
        assertThat(job.getFinishedAt()).isNotNull();
    }

    @Test
    void finish_pendingJobWithCompletedResult_isRejected() {
        Job job = newJob(5);
        assertThat(job.finish(JobResult.of(TerminalReason.ACCEPTED_HIGH_SCORE, null))).isFalse();
        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
    }

    @Test
    void finishIfPending_pendingJob_cancels() {
        Job job = newJob(5);

        assertThat(job.finishIfPending(JobResult.of(TerminalReason.CANCELLED, null))).isTrue();
        assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(job.markRunning()).isFalse();
    }

    @Test
    void finishIfPending_runningJob_doesNothing() {
        Job job = newJob(5);
        job.markRunning();

        assertThat(job.finishIfPending(JobResult.of(TerminalReason.CANCELLED, null))).isFalse();
        assertThat(job.getStatus()).isEqualTo(JobStatus.RUNNING);
    }

    // ------------------------------------------------------------------
    // Tier
    // ------------------------------------------------------------------

    @Test
    void escalateTo_neverDowngrades() {
        Job job = newJob(5);
        job.escalateTo(Tier.PREMIUM);
        job.escalateTo(Tier.LOCAL_PLUS);
        assertThat(job.getCurrentTier()).isEqualTo(Tier.PREMIUM);
    }

    // ------------------------------------------------------------------
    // Conversation
    // ------------------------------------------------------------------

    @Test
    void conversation_isCreatedOnceAndClearedOnDemand() {
        Job job = newJob(5);
        ConversationState first = job.conversation();

        assertThat(job.conversation()).isSameAs(first);
        job.clearConversation();
        assertThat(job.existingConversation()).isEmpty();
        assertThat(job.conversation()).isNotSameAs(first);
    }

    // ------------------------------------------------------------------
    // snapshot
    // ------------------------------------------------------------------

    @Test
    void snapshot_reportsScoresAndProgress() {
        Job job = newJob(4);
        job.markRunning();
        job.getHistory().append(attempt(1, Tier.LOCAL, 6.0));
        job.getHistory().append(attempt(2, Tier.LOCAL, 4.0));

        JobSnapshot snap = job.snapshot();

        assertThat(snap.currentAttempt()).isEqualTo(2);
        assertThat(snap.lastScore()).isEqualTo(4.0);
        assertThat(snap.bestScore()).isEqualTo(6.0);
        assertThat(snap.progress()).isEqualTo(45);
        assertThat(snap.status()).isEqualTo(JobStatus.RUNNING);
    }

    @Test
    void snapshot_terminalJob_isAtFullProgress() {
        Job job = newJob(4);
        job.markRunning();
        job.finish(JobResult.of(TerminalReason.CANCELLED, null));

        assertThat(job.snapshot().progress()).isEqualTo(100);
    }

    @Test
    void snapshot_doesNotChangeWhenJobMovesOn() {
        Job job = newJob(4);
        job.markRunning();
        JobSnapshot before = job.snapshot();

        job.getHistory().append(attempt(1, Tier.LOCAL, 6.0));
        job.conversation().addFeedback("use streams");

        assertThat(before.attempts()).isEmpty();
        assertThat(before.feedback()).isEmpty();
        assertThat(before.lastScore()).isNull();
    }

    private Job newJob(int maxIterations) {
        return new Job(UUID.randomUUID(), "Write a CSV parser", "java", maxIterations, clock);
    }
}
