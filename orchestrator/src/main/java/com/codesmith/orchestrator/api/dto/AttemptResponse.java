package com.codesmith.orchestrator.api.dto;

import com.codesmith.orchestrator.model.Attempt;
import com.codesmith.orchestrator.model.Issue;
import com.codesmith.orchestrator.model.Tier;

import java.time.Instant;
import java.util.List;

/**
 * One attempt as returned by GET /jobs/{id}/attempts.
 * The artifact is included so callers can diff attempts.
 */
public record AttemptResponse(
        int         number,
        Tier        tier,
        String      model,
        double      score,
        List<Issue> issues,
        String      buildErrors,
        String      summary,
        String      artifact,
        long        durationMs,
        Instant     timestamp
) {
    public static AttemptResponse from(Attempt a) {
        return new AttemptResponse(
                a.number(),
                a.tier(),
                a.model(),
                a.score(),
                a.issues(),
                a.buildErrors(),
                a.summary(),
                a.artifact(),
                a.duration() == null ? 0 : a.duration().toMillis(),
                a.timestamp()
        );
    }
}
