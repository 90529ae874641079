package com.codesmith.orchestrator.engine.conversation;

import com.codesmith.orchestrator.TestClock;
import com.codesmith.orchestrator.engine.conversation.ConversationGate.Kind;
import com.codesmith.orchestrator.engine.conversation.ConversationGate.Outcome;
import com.codesmith.orchestrator.model.Answer;
import com.codesmith.orchestrator.model.ConversationState.AnswerOutcome;
import com.codesmith.orchestrator.model.Job;
import com.codesmith.orchestrator.model.Question;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ConversationGateTest {

    private static final Ambiguity AUTH = new Ambiguity("authentication",
            "Which authentication method should be used?", List.of("JWT", "OAuth2"), "JWT", "Authentication");

    private static final Ambiguity NO_DEFAULT = new Ambiguity("database",
            "Which database should be used?", List.of("PostgreSQL", "MySQL"), null, "Database");

    private QuestionChannel     channel;
    private SimpleMeterRegistry meterRegistry;
    private ConversationGate    gate;
    private Job                 job;

    @BeforeEach
    void setUp() {
        channel = mock(QuestionChannel.class);
        meterRegistry = new SimpleMeterRegistry();
        TestClock clock = new TestClock();
        gate = new ConversationGate(channel, meterRegistry, clock, Duration.ofSeconds(5));
        job = new Job(UUID.randomUUID(), "Add login", "java", 5, clock);
    }

    @Test
    void ask_userAnswersOnPublish_returnsAnswered() {
        doAnswer(inv -> {
            Question q = inv.getArgument(0);
            job.conversation().answer(q.id(), "OAuth2", Answer.Source.USER);
            return null;
        }).when(channel).publish(any());

        Outcome outcome = gate.ask(job, AUTH);

        assertThat(outcome.kind()).isEqualTo(Kind.ANSWERED);
        assertThat(outcome.answer().text()).isEqualTo("OAuth2");
        assertThat(outcome.answer().source()).isEqualTo(Answer.Source.USER);
        assertThat(outcome.question().jobId()).isEqualTo(job.getId());
        assertThat(meterRegistry.timer("codesmith.gate.wait", "outcome", "answered").count()).isEqualTo(1);
    }

    @Test
    void ask_answerFromAnotherThread_unblocksTheWait() throws Exception {
        CompletableFuture<Outcome> pending = CompletableFuture.supplyAsync(() -> gate.ask(job, AUTH));

        Question question = awaitQuestion();
        job.conversation().answer(question.id(), "JWT", Answer.Source.USER);

        Outcome outcome = pending.get(5, TimeUnit.SECONDS);
        assertThat(outcome.kind()).isEqualTo(Kind.ANSWERED);
        assertThat(outcome.answer().source()).isEqualTo(Answer.Source.USER);
    }

    @Test
    void ask_timeoutWithDefault_recordsDefaultAnswer() {
        Outcome outcome = gate.ask(job, AUTH, Duration.ofMillis(50));

        assertThat(outcome.kind()).isEqualTo(Kind.DEFAULTED);
        assertThat(outcome.answer().text()).isEqualTo("JWT");
        assertThat(outcome.answer().source()).isEqualTo(Answer.Source.DEFAULT);
        assertThat(job.conversation().answerOf(outcome.question().id()))
                .map(Answer::text).contains("JWT");
    }

    @Test
    void ask_lateAnswerAfterDefault_isIgnored() {
        Outcome outcome = gate.ask(job, AUTH, Duration.ofMillis(50));

        AnswerOutcome late = job.conversation().answer(outcome.question().id(), "OAuth2", Answer.Source.USER);

        assertThat(late).isEqualTo(AnswerOutcome.IGNORED);
        assertThat(job.conversation().answerOf(outcome.question().id()))
                .map(Answer::text).contains("JWT");
    }

    @Test
    void ask_timeoutWithoutDefault_returnsTimedOutAndClosesQuestion() {
        Outcome outcome = gate.ask(job, NO_DEFAULT, Duration.ofMillis(50));

        assertThat(outcome.kind()).isEqualTo(Kind.TIMED_OUT);
        assertThat(outcome.hasAnswer()).isFalse();
        assertThat(job.snapshot().pendingQuestions()).isEmpty();
        assertThat(job.snapshot().questions()).singleElement()
                .satisfies(q -> assertThat(q.isExpired()).isTrue());
        assertThat(job.conversation().answer(outcome.question().id(), "PostgreSQL", Answer.Source.USER))
                .isEqualTo(AnswerOutcome.EXPIRED);
        assertThat(job.conversation().answerOf(outcome.question().id())).isEmpty();
        assertThat(meterRegistry.timer("codesmith.gate.wait", "outcome", "timed_out").count()).isEqualTo(1);
    }

    @Test
    void ask_cancelWhileWaiting_returnsCancelled() throws Exception {
        CompletableFuture<Outcome> pending = CompletableFuture.supplyAsync(() -> gate.ask(job, NO_DEFAULT));

        awaitQuestion();
        job.getCancellation().cancel();

        Outcome outcome = pending.get(5, TimeUnit.SECONDS);
        assertThat(outcome.kind()).isEqualTo(Kind.CANCELLED);
        assertThat(outcome.hasAnswer()).isFalse();
        assertThat(job.snapshot().pendingQuestions()).isEmpty();
    }

    @Test
    void ask_alreadyCancelled_returnsWithoutWaiting() {
        job.getCancellation().cancel();

        Outcome outcome = gate.ask(job, AUTH, Duration.ofSeconds(30));

        assertThat(outcome.kind()).isEqualTo(Kind.CANCELLED);
    }

    @Test
    void ask_publishFails_stillWaitsForAnswer() {
        doThrow(new IllegalStateException("no listeners")).when(channel).publish(any());

        Outcome outcome = gate.ask(job, AUTH, Duration.ofMillis(50));

        verify(channel).publish(any());
        assertThat(outcome.kind()).isEqualTo(Kind.DEFAULTED);
    }

    private Question awaitQuestion() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            var questions = job.conversation().snapshot();
            if (!questions.isEmpty()) {
                return questions.get(0).question();
            }
            Thread.sleep(5);
        }
        throw new AssertionError("question was never registered");
    }
}
