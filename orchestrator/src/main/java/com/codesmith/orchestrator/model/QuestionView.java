package com.codesmith.orchestrator.model;

/**
 * Read-only pairing of a question with its answer, if any.
 *
 * @param closed true once the question is answered or expired
 */
public record QuestionView(Question question, Answer answer, boolean closed) {

    public boolean isPending() {
        return !closed;
    }

    public boolean isExpired() {
        return closed && answer == null;
    }
}
