package com.codesmith.orchestrator.api.dto;

import com.codesmith.orchestrator.model.JobResult;
import com.codesmith.orchestrator.model.JobSnapshot;
import com.codesmith.orchestrator.model.JobStatus;
import com.codesmith.orchestrator.model.TerminalReason;
import com.codesmith.orchestrator.model.Tier;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /jobs, GET /jobs and GET /jobs/{id}.
 * Contains enough information for the caller to poll job progress;
 * the attempt list has its own endpoint.
 */
public record JobResponse(
        UUID           id,
        String         task,
        String         language,
        JobStatus      status,
        int            currentAttempt,
        int            maxIterations,
        int            progress,
        Double         lastScore,
        Double         bestScore,
        Tier           currentTier,
        int            pendingQuestions,
        Instant        createdAt,
        Instant        startedAt,
        Instant        finishedAt,
        Result         result
) {
    /**
     * @param attemptNumber the attempt the artifact comes from; null if none ran
     */
    public record Result(TerminalReason reason, String message, Integer attemptNumber,
                         Double score, String artifact) {

        static Result from(JobResult r) {
            if (r == null) return null;
            return new Result(
                    r.reason(),
                    r.message(),
                    r.attempt() == null ? null : r.attempt().number(),
                    r.score(),
                    r.artifact());
        }
    }

    public static JobResponse from(JobSnapshot s) {
        return new JobResponse(
                s.id(),
                s.task(),
                s.language(),
                s.status(),
                s.currentAttempt(),
                s.maxIterations(),
                s.progress(),
                s.lastScore(),
                s.bestScore(),
                s.currentTier(),
                s.pendingQuestions().size(),
                s.createdAt(),
                s.startedAt(),
                s.finishedAt(),
                Result.from(s.result())
        );
    }
}
