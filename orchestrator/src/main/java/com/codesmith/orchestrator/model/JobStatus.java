package com.codesmith.orchestrator.model;

/**
 * Lifecycle of a code-generation Job.
 *
 * Transitions:
 *   PENDING → RUNNING                 (a worker picked the job up)
 *   PENDING → CANCELLED               (cancelled while still queued)
 *   RUNNING → COMPLETED | FAILED | CANCELLED
 *
 * Terminal states are entered exactly once and never left.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /** True if moving from this state to {@code next} is a forward step of the state machine. */
    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == CANCELLED;
            case RUNNING -> next.isTerminal();
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
