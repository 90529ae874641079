package com.codesmith.orchestrator.service;

import com.codesmith.orchestrator.config.CodesmithProperties;
import com.codesmith.orchestrator.engine.JobOrchestrator;
import com.codesmith.orchestrator.engine.JobRegistry;
import com.codesmith.orchestrator.model.Answer;
import com.codesmith.orchestrator.model.ConversationState.AnswerOutcome;
import com.codesmith.orchestrator.model.Job;
import com.codesmith.orchestrator.model.JobSnapshot;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Job control surface: start, inspect, cancel, answer, clean up.
 *
 * Each started job gets one task on the worker pool; the pool size caps how
 * many jobs run their attempt loops at the same time. Everything handed back
 * to callers is a {@link JobSnapshot}, never the live job.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobRegistry            registry;
    private final JobOrchestrator        orchestrator;
    private final FailureReportGenerator reportGenerator;
    private final ExecutorService        workers;
    private final CodesmithProperties.Jobs settings;
    private final Clock                  clock;

    public JobService(JobRegistry registry,
                      JobOrchestrator orchestrator,
                      FailureReportGenerator reportGenerator,
                      @Qualifier("jobWorkers") ExecutorService workers,
                      CodesmithProperties properties,
                      Clock clock) {
        this.registry        = registry;
        this.orchestrator    = orchestrator;
        this.reportGenerator = reportGenerator;
        this.workers         = workers;
        this.settings        = properties.getJobs();
        this.clock           = clock;
    }

    // ------------------------------------------------------------------
    // Job submission
    // ------------------------------------------------------------------

    /**
     * Register a job and queue its attempt loop.
     *
     * @param language      target language; null or blank uses the configured default
     * @param maxIterations attempt cap; null uses the configured default
     * @throws IllegalArgumentException if the task is blank or maxIterations is below 1
     */
    public JobSnapshot startJob(String task, String language, Integer maxIterations) {
        int cap = maxIterations == null ? settings.getDefaultMaxIterations() : maxIterations;
        String lang = language == null || language.isBlank() ? settings.getDefaultLanguage() : language.trim();

        Job job = new Job(UUID.randomUUID(), task, lang, cap, clock);
        registry.register(job);
        log.info("Job {} submitted (language={}, maxIterations={})", job.getId(), lang, cap);

        try {
            workers.submit(() -> {
                try {
                    orchestrator.run(job);
                } catch (Exception e) {
                    // run() handles its own failures; anything here is a bug in the worker wrapper.
                    log.error("Unhandled error in attempt loop for job {}", job.getId(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            registry.remove(job.getId());
            throw new IllegalStateException("Worker pool is shut down, job " + job.getId() + " not started", e);
        }
        return job.snapshot();
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    public Optional<JobSnapshot> getStatus(UUID id) {
        return registry.find(id).map(Job::snapshot);
    }

    public List<JobSnapshot> listJobs() {
        return registry.all().stream().map(Job::snapshot).toList();
    }

    /**
     * Markdown report of how the job went. Empty if the job is unknown.
     * The report for a job that is still running covers the attempts so far.
     */
    public Optional<String> report(UUID id) {
        return getStatus(id).map(reportGenerator::generate);
    }

    // ------------------------------------------------------------------
    // Control
    // ------------------------------------------------------------------

    /** @return false if no such job exists */
    public boolean cancelJob(UUID id) {
        return registry.cancel(id);
    }

    /**
     * Deliver an answer to a pending question.
     *
     * @return empty if the job is unknown; otherwise whether the answer was taken
     */
    public Optional<AnswerOutcome> submitAnswer(UUID jobId, String questionId, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("answer must not be blank");
        }
        return registry.find(jobId).map(job -> job.existingConversation()
                .map(conversation -> conversation.answer(questionId, text.trim(), Answer.Source.USER))
                .orElse(AnswerOutcome.UNKNOWN_QUESTION));
    }

    /**
     * Record out-of-band guidance. It is shown in the prompt of every later attempt.
     *
     * @return false if no such job exists
     */
    public boolean submitFeedback(UUID jobId, String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("feedback must not be blank");
        }
        Optional<Job> job = registry.find(jobId);
        job.ifPresent(j -> {
            j.conversation().addFeedback(message.trim());
            log.info("Feedback recorded for job {}", jobId);
        });
        return job.isPresent();
    }

    /**
     * Remove a finished job and everything it holds.
     *
     * @return the final snapshot, or empty if no such job exists
     * @throws IllegalStateException if the job has not reached a terminal state
     */
    public Optional<JobSnapshot> cleanup(UUID id) {
        Optional<Job> job = registry.find(id);
        if (job.isEmpty()) {
            return Optional.empty();
        }
        JobSnapshot last = job.get().snapshot();
        if (!last.status().isTerminal()) {
            throw new IllegalStateException("Job " + id + " is " + last.status() + "; cancel it before cleanup");
        }
        registry.remove(id);
        return Optional.of(last);
    }

    // ------------------------------------------------------------------
    // Shutdown
    // ------------------------------------------------------------------

    /**
     * Cancel every job and stop the workers. Running jobs notice the signal
     * at their next suspension point and finish as CANCELLED.
     */
    @PreDestroy
    public void shutdown() {
        log.info("Shutting down job workers, cancelling {} jobs", registry.size());
        registry.all().forEach(job -> registry.cancel(job.getId()));
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Job workers did not stop within 10s, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }
}
