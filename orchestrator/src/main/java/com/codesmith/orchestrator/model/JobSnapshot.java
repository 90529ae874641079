package com.codesmith.orchestrator.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Point-in-time copy of a job handed to status readers.
 * Holds no live references into the job.
 */
public record JobSnapshot(
        UUID               id,
        String             task,
        String             language,
        JobStatus          status,
        int                currentAttempt,
        Double             lastScore,
        Double             bestScore,
        Tier               currentTier,
        int                maxIterations,
        int                progress,
        Instant            createdAt,
        Instant            startedAt,
        Instant            finishedAt,
        List<Attempt>      attempts,
        List<QuestionView> questions,
        List<Feedback>     feedback,
        JobResult          result
) {
    static JobSnapshot of(Job job, JobStatus status, Instant startedAt, Instant finishedAt,
                          JobResult result, List<Attempt> attempts,
                          List<QuestionView> questions, List<Feedback> feedback) {
        Double lastScore = attempts.isEmpty() ? null : attempts.get(attempts.size() - 1).score();
        Double bestScore = AttemptHistory.best(attempts).map(Attempt::score).orElse(null);
        // Attempts fill up to 90%; the last 10% is reserved for the terminal transition.
        int progress = status.isTerminal()
                ? 100
                : (attempts.size() * 90) / job.getMaxIterations();
        return new JobSnapshot(
                job.getId(),
                job.getTask(),
                job.getLanguage(),
                status,
                attempts.size(),
                lastScore,
                bestScore,
                job.getCurrentTier(),
                job.getMaxIterations(),
                progress,
                job.getCreatedAt(),
                startedAt,
                finishedAt,
                attempts,
                questions,
                feedback,
                result);
    }

    public List<QuestionView> pendingQuestions() {
        return questions.stream().filter(QuestionView::isPending).toList();
    }
}
