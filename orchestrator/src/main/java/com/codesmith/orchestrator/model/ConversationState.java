package com.codesmith.orchestrator.model;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-job question/answer state.
 *
 * Each question owns a future that is completed exactly once: by a user
 * answer, by the timeout default, or with null when the question expires
 * unanswered. Completion is atomic, so readers see a question as pending,
 * answered or expired and never anything in between. Later answers to the
 * same question are ignored.
 */
public class ConversationState {

    public enum AnswerOutcome { ACCEPTED, IGNORED, EXPIRED, UNKNOWN_QUESTION }

    private record Slot(Question question, CompletableFuture<Answer> answer) {}

    private final Map<String, Slot>  questions = new ConcurrentHashMap<>();
    private final List<Feedback>     feedback  = new CopyOnWriteArrayList<>();
    private final Clock              clock;
    private volatile Instant         lastActivity;

    public ConversationState(Clock clock) {
        this.clock        = clock;
        this.lastActivity = clock.instant();
    }

    public void register(Question question) {
        Slot previous = questions.putIfAbsent(question.id(), new Slot(question, new CompletableFuture<>()));
        if (previous != null) {
            throw new IllegalStateException("Duplicate question id " + question.id());
        }
        touch();
    }

    /**
     * Record an answer. The first answer for a question wins.
     */
    public AnswerOutcome answer(String questionId, String text, Answer.Source source) {
        Slot slot = questions.get(questionId);
        if (slot == null) {
            return AnswerOutcome.UNKNOWN_QUESTION;
        }
        touch();
        if (slot.answer().complete(new Answer(text, source, clock.instant()))) {
            return AnswerOutcome.ACCEPTED;
        }
        return slot.answer().getNow(null) == null ? AnswerOutcome.EXPIRED : AnswerOutcome.IGNORED;
    }

    /**
     * Close a question that will never be answered.
     *
     * @return false if an answer was recorded first
     */
    public boolean expire(String questionId) {
        Slot slot = questions.get(questionId);
        if (slot == null) {
            throw new IllegalArgumentException("Unknown question " + questionId);
        }
        touch();
        return slot.answer().complete(null);
    }

    /** Future for the gate to block on. Completing the returned copy has no effect on the state. */
    public CompletableFuture<Answer> answerFuture(String questionId) {
        Slot slot = questions.get(questionId);
        if (slot == null) {
            throw new IllegalArgumentException("Unknown question " + questionId);
        }
        return slot.answer().copy();
    }

    public Optional<Answer> answerOf(String questionId) {
        Slot slot = questions.get(questionId);
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.answer().getNow(null));
    }

    public void addFeedback(String message) {
        feedback.add(new Feedback(message, clock.instant()));
        touch();
    }

    public List<Feedback> feedback() {
        return List.copyOf(feedback);
    }

    /** All questions in creation order with their current answers. */
    public List<QuestionView> snapshot() {
        return questions.values().stream()
                .sorted(Comparator.comparing((Slot s) -> s.question().createdAt())
                        .thenComparing(s -> s.question().id()))
                .map(s -> new QuestionView(s.question(), s.answer().getNow(null), s.answer().isDone()))
                .toList();
    }

    public boolean hasPendingQuestions() {
        return questions.values().stream().anyMatch(s -> !s.answer().isDone());
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    private void touch() {
        lastActivity = clock.instant();
    }
}
