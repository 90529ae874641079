package com.codesmith.orchestrator.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One generate-then-validate cycle within a Job.
 *
 * Immutable once created. Attempts are appended to the job's
 * {@link AttemptHistory} in order and are never rewritten.
 */
public record Attempt(
        int          number,
        Tier         tier,
        String       model,
        double       score,
        List<Issue>  issues,
        String       buildErrors,
        String       summary,
        String       artifact,
        Duration     duration,
        Instant      timestamp
) {
    public Attempt {
        if (number < 1) {
            throw new IllegalArgumentException("Attempt numbers start at 1, got " + number);
        }
        if (!(score >= 0 && score <= 10)) {
            throw new IllegalArgumentException("Score must be within 0..10, got " + score);
        }
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    /**
     * An attempt whose generation or validation call threw.
     * Recorded with score 0 and the exception text as build errors so the
     * next prompt can show what went wrong.
     */
    public static Attempt failed(int number, Tier tier, String model, String error,
                                 Duration duration, Instant timestamp) {
        return new Attempt(number, tier, model, 0.0, List.of(), error,
                "Attempt failed before producing a score", null, duration, timestamp);
    }

    public boolean hasBuildErrors() {
        return buildErrors != null && !buildErrors.isBlank();
    }
}
