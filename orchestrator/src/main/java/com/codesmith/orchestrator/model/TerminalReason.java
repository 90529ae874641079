package com.codesmith.orchestrator.model;

/**
 * Machine-readable reason attached to every terminal job result.
 */
public enum TerminalReason {
    ACCEPTED_HIGH_SCORE("score reached the high bar"),
    ACCEPTED_GOOD_ENOUGH("acceptable score after minimum attempts"),
    MAX_ATTEMPTS_EXHAUSTED("max attempts exhausted"),
    NO_ANSWER("no answer"),
    CANCELLED("cancelled"),
    INTERNAL_ERROR("internal error");

    private final String description;

    TerminalReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    public JobStatus status() {
        return switch (this) {
            case ACCEPTED_HIGH_SCORE, ACCEPTED_GOOD_ENOUGH -> JobStatus.COMPLETED;
            case CANCELLED -> JobStatus.CANCELLED;
            case MAX_ATTEMPTS_EXHAUSTED, NO_ANSWER, INTERNAL_ERROR -> JobStatus.FAILED;
        };
    }
}
