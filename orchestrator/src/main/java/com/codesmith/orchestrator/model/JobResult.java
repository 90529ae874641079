package com.codesmith.orchestrator.model;

/**
 * Terminal outcome of a job.
 *
 * @param reason   machine-readable reason code
 * @param message  human-readable detail
 * @param attempt  the attempt the result is taken from; null if no attempt ran
 */
public record JobResult(TerminalReason reason, String message, Attempt attempt) {

    public static JobResult of(TerminalReason reason, Attempt attempt) {
        return new JobResult(reason, reason.description(), attempt);
    }

    public JobStatus status() {
        return reason.status();
    }

    public String artifact() {
        return attempt == null ? null : attempt.artifact();
    }

    public Double score() {
        return attempt == null ? null : attempt.score();
    }
}
