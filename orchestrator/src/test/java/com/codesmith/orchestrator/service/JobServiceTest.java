package com.codesmith.orchestrator.service;

import com.codesmith.orchestrator.TestClock;
import com.codesmith.orchestrator.config.CodesmithProperties;
import com.codesmith.orchestrator.engine.JobOrchestrator;
import com.codesmith.orchestrator.engine.JobRegistry;
import com.codesmith.orchestrator.model.Answer;
import com.codesmith.orchestrator.model.ConversationState.AnswerOutcome;
import com.codesmith.orchestrator.model.Job;
import com.codesmith.orchestrator.model.JobResult;
import com.codesmith.orchestrator.model.JobSnapshot;
import com.codesmith.orchestrator.model.JobStatus;
import com.codesmith.orchestrator.model.Question;
import com.codesmith.orchestrator.model.TerminalReason;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

/**
 * JobService with a real registry and worker pool. The orchestrator is
 * mocked, so submitted jobs stay PENDING unless a test moves them on.
 */
@ExtendWith(MockitoExtension.class)
class JobServiceTest {

    @Mock JobOrchestrator orchestrator;

    private JobRegistry         registry;
    private ExecutorService     workers;
    private CodesmithProperties properties;
    private TestClock           clock;
    private JobService          service;

    @BeforeEach
    void setUp() {
        registry = new JobRegistry();
        workers = Executors.newSingleThreadExecutor();
        properties = new CodesmithProperties();
        clock = new TestClock();
        service = new JobService(registry, orchestrator, new FailureReportGenerator(), workers, properties, clock);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    // ------------------------------------------------------------------
    // startJob()
    // ------------------------------------------------------------------

    @Test
    void startJob_defaults_appliedAndQueued() {
        JobSnapshot job = service.startJob("Write a CSV parser", null, null);

        assertThat(job.status()).isEqualTo(JobStatus.PENDING);
        assertThat(job.language()).isEqualTo("java");
        assertThat(job.maxIterations()).isEqualTo(10);
        assertThat(registry.find(job.id())).isPresent();
        verify(orchestrator, timeout(2_000)).run(any(Job.class));
    }

    @Test
    void startJob_explicitValues_override() {
        JobSnapshot job = service.startJob("Write a CSV parser", " python ", 3);

        assertThat(job.language()).isEqualTo("python");
        assertThat(job.maxIterations()).isEqualTo(3);
    }

    @Test
    void startJob_blankTask_throwsAndRegistersNothing() {
        assertThatThrownBy(() -> service.startJob("  ", "java", 5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.size()).isZero();
    }

    @Test
    void startJob_zeroIterations_throws() {
        assertThatThrownBy(() -> service.startJob("Write a CSV parser", "java", 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxIterations");
    }

    @Test
    void startJob_poolShutDown_throwsAndRollsBack() {
        workers.shutdown();

        assertThatThrownBy(() -> service.startJob("Write a CSV parser", "java", 5))
                .isInstanceOf(IllegalStateException.class);
        assertThat(registry.size()).isZero();
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Test
    void getStatus_unknownJob_empty() {
        assertThat(service.getStatus(UUID.randomUUID())).isEmpty();
        assertThat(service.report(UUID.randomUUID())).isEmpty();
    }

    @Test
    void report_knownJob_rendersMarkdown() {
        JobSnapshot job = service.startJob("Write a CSV parser", "java", 5);

        assertThat(service.report(job.id())).hasValueSatisfying(r -> assertThat(r)
                .startsWith("# Job Report: " + job.id())
                .contains("Write a CSV parser"));
    }

    // ------------------------------------------------------------------
    // Answers and feedback
    // ------------------------------------------------------------------

    @Test
    void submitAnswer_pendingQuestion_acceptedAndTrimmed() {
        Job job = startedJob();
        Question q = question(job);
        job.conversation().register(q);

        assertThat(service.submitAnswer(job.getId(), q.id(), "  OAuth2 ")).contains(AnswerOutcome.ACCEPTED);
        assertThat(job.conversation().answerOf(q.id())).hasValueSatisfying(a -> {
            assertThat(a.text()).isEqualTo("OAuth2");
            assertThat(a.source()).isEqualTo(Answer.Source.USER);
        });
        assertThat(service.submitAnswer(job.getId(), q.id(), "JWT")).contains(AnswerOutcome.IGNORED);
    }

    @Test
    void submitAnswer_noConversationYet_unknownQuestion() {
        Job job = startedJob();

        assertThat(service.submitAnswer(job.getId(), "q-1", "JWT")).contains(AnswerOutcome.UNKNOWN_QUESTION);
    }

    @Test
    void submitAnswer_unknownJob_empty() {
        assertThat(service.submitAnswer(UUID.randomUUID(), "q-1", "JWT")).isEmpty();
    }

    @Test
    void submitAnswer_blankText_throws() {
        Job job = startedJob();

        assertThatThrownBy(() -> service.submitAnswer(job.getId(), "q-1", " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void submitFeedback_recordsTrimmedMessage() {
        Job job = startedJob();

        assertThat(service.submitFeedback(job.getId(), " use records ")).isTrue();

        assertThat(job.snapshot().feedback()).singleElement()
                .satisfies(f -> assertThat(f.message()).isEqualTo("use records"));
        assertThat(service.submitFeedback(UUID.randomUUID(), "hi")).isFalse();
        assertThatThrownBy(() -> service.submitFeedback(job.getId(), ""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Cancel and cleanup
    // ------------------------------------------------------------------

    @Test
    void cancelJob_pendingJob_cancelled() {
        Job job = startedJob();

        assertThat(service.cancelJob(job.getId())).isTrue();
        assertThat(service.getStatus(job.getId())).map(JobSnapshot::status).contains(JobStatus.CANCELLED);
        assertThat(service.cancelJob(UUID.randomUUID())).isFalse();
    }

    @Test
    void cleanup_runningJob_throwsAndKeepsJob() {
        Job job = startedJob();
        job.markRunning();

        assertThatThrownBy(() -> service.cleanup(job.getId()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("RUNNING");
        assertThat(registry.find(job.getId())).isPresent();
    }

    @Test
    void cleanup_finishedJob_removedAndReturnsLastSnapshot() {
        Job job = startedJob();
        job.markRunning();
        job.finish(JobResult.of(TerminalReason.MAX_ATTEMPTS_EXHAUSTED, null));

        assertThat(service.cleanup(job.getId())).map(JobSnapshot::status).contains(JobStatus.FAILED);
        assertThat(registry.find(job.getId())).isEmpty();
        assertThat(service.cleanup(job.getId())).isEmpty();
    }

    @Test
    void shutdown_cancelsEveryJobAndStopsWorkers() {
        Job pending = startedJob();
        Job running = startedJob();
        running.markRunning();

        service.shutdown();

        assertThat(pending.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(running.getCancellation().isCancellationRequested()).isTrue();
        assertThat(workers.isShutdown()).isTrue();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Job startedJob() {
        JobSnapshot snapshot = service.startJob("Add login to the admin page", "java", 5);
        return registry.find(snapshot.id()).orElseThrow();
    }

    private Question question(Job job) {
        return new Question(Question.newId(), job.getId(), "Which authentication method should be used?",
                List.of("JWT", "OAuth2"), "JWT", "Authentication", clock.instant());
    }
}
