package com.codesmith.orchestrator.engine.conversation;

import com.codesmith.orchestrator.model.Answer;
import com.codesmith.orchestrator.model.CancellationToken;
import com.codesmith.orchestrator.model.ConversationState;
import com.codesmith.orchestrator.model.ConversationState.AnswerOutcome;
import com.codesmith.orchestrator.model.Job;
import com.codesmith.orchestrator.model.Question;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blocks a job until a human answers a question.
 *
 * The wait ends on the first of: an answer, the timeout, or the job's
 * cancellation. It blocks on futures and never polls.
 *
 * <pre>
 *   codesmith.gate.wait{outcome="answered|defaulted|timed_out|cancelled"}
 * </pre>
 */
public class ConversationGate {

    private static final Logger log = LoggerFactory.getLogger(ConversationGate.class);

    public enum Kind { ANSWERED, DEFAULTED, TIMED_OUT, CANCELLED }

    /**
     * @param answer the recorded answer; null for TIMED_OUT and CANCELLED
     */
    public record Outcome(Kind kind, Question question, Answer answer) {

        public boolean hasAnswer() {
            return answer != null;
        }
    }

    private final QuestionChannel channel;
    private final MeterRegistry   meterRegistry;
    private final Clock           clock;
    private final Duration        defaultTimeout;

    public ConversationGate(QuestionChannel channel, MeterRegistry meterRegistry,
                            Clock clock, Duration defaultTimeout) {
        this.channel        = channel;
        this.meterRegistry  = meterRegistry;
        this.clock          = clock;
        this.defaultTimeout = defaultTimeout;
    }

    public Outcome ask(Job job, Ambiguity ambiguity) {
        return ask(job, ambiguity, defaultTimeout);
    }

    /**
     * Publish a question for {@code job} and wait for the answer.
     */
    public Outcome ask(Job job, Ambiguity ambiguity, Duration timeout) {
        Question question = new Question(Question.newId(), job.getId(), ambiguity.question(),
                ambiguity.choices(), ambiguity.defaultAnswer(), ambiguity.category(), clock.instant());
        ConversationState conversation = job.conversation();
        conversation.register(question);

        try {
            channel.publish(question);
        } catch (Exception e) {
            // Pollers can still see and answer the question, so keep waiting.
            log.warn("Could not publish question {} for job {}: {}",
                    question.id(), job.getId(), e.getMessage());
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        Outcome outcome = await(job.getCancellation(), conversation, question, timeout);
        sample.stop(meterRegistry.timer("codesmith.gate.wait",
                "outcome", outcome.kind().name().toLowerCase()));

        log.info("Question {} resolved as {}{}", question.id(), outcome.kind(),
                outcome.hasAnswer() ? ": " + outcome.answer().text() : "");
        return outcome;
    }

    private Outcome await(CancellationToken cancellation, ConversationState conversation,
                          Question question, Duration timeout) {
        CompletableFuture<Answer> answer = conversation.answerFuture(question.id());
        CompletableFuture<Void> cancelled = cancellation.whenCancelled();
        try {
            CompletableFuture.anyOf(answer, cancelled).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return onTimeout(conversation, question);
        } catch (InterruptedException e) {
            // Worker shutdown: treat like a cancellation of this job.
            Thread.currentThread().interrupt();
            cancellation.cancel();
            return onCancelled(conversation, question);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Answer future failed for question " + question.id(), e.getCause());
        }

        // An answer that arrived together with a cancellation still counts.
        Answer received = answer.getNow(null);
        if (received != null) {
            return new Outcome(Kind.ANSWERED, question, received);
        }
        return onCancelled(conversation, question);
    }

    private Outcome onCancelled(ConversationState conversation, Question question) {
        if (!conversation.expire(question.id())) {
            return new Outcome(Kind.ANSWERED, question, conversation.answerOf(question.id()).orElseThrow());
        }
        return new Outcome(Kind.CANCELLED, question, null);
    }

    private Outcome onTimeout(ConversationState conversation, Question question) {
        if (!question.hasDefault()) {
            if (!conversation.expire(question.id())) {
                return new Outcome(Kind.ANSWERED, question, conversation.answerOf(question.id()).orElseThrow());
            }
            log.warn("No answer to question {} within the timeout and no default", question.id());
            return new Outcome(Kind.TIMED_OUT, question, null);
        }
        AnswerOutcome recorded = conversation.answer(question.id(), question.defaultAnswer(), Answer.Source.DEFAULT);
        Answer answer = conversation.answerOf(question.id()).orElseThrow();
        if (recorded == AnswerOutcome.IGNORED) {
            // A user answer beat the default by a hair.
            return new Outcome(Kind.ANSWERED, question, answer);
        }
        log.warn("No answer to question {} within the timeout, using default '{}'",
                question.id(), question.defaultAnswer());
        return new Outcome(Kind.DEFAULTED, question, answer);
    }
}
