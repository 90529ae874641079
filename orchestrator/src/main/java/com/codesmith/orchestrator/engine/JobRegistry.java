package com.codesmith.orchestrator.engine;

import com.codesmith.orchestrator.model.Job;
import com.codesmith.orchestrator.model.JobResult;
import com.codesmith.orchestrator.model.TerminalReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory home of every job until it is cleaned up.
 *
 * Backed by a ConcurrentHashMap: workers, API handlers and the reaper can
 * insert, look up and remove jobs concurrently, and operations on different
 * jobs never block each other.
 */
@Component
public class JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final ConcurrentHashMap<UUID, Job> jobs = new ConcurrentHashMap<>();

    public void register(Job job) {
        Job previous = jobs.putIfAbsent(job.getId(), job);
        if (previous != null) {
            throw new IllegalStateException("Job " + job.getId() + " is already registered");
        }
    }

    public Optional<Job> find(UUID id) {
        return Optional.ofNullable(jobs.get(id));
    }

    /** All jobs, oldest first. */
    public List<Job> all() {
        return jobs.values().stream()
                .sorted(Comparator.comparing(Job::getCreatedAt))
                .toList();
    }

    public int size() {
        return jobs.size();
    }

    /**
     * Signal cancellation to a job.
     *
     * A job still waiting for a worker is finished as CANCELLED right away.
     * A running job notices the signal at its next suspension point.
     *
     * @return false if no such job exists
     */
    public boolean cancel(UUID id) {
        Job job = jobs.get(id);
        if (job == null) {
            return false;
        }
        if (job.getCancellation().cancel()) {
            log.info("Cancellation requested for job {}", id);
        }
        if (job.finishIfPending(JobResult.of(TerminalReason.CANCELLED, null))) {
            log.info("Job {} cancelled before it started", id);
        }
        return true;
    }

    /**
     * Remove a job and release its conversation state. The job's token is
     * cancelled so nothing keeps waiting on it.
     */
    public Optional<Job> remove(UUID id) {
        Job job = jobs.remove(id);
        if (job != null) {
            job.getCancellation().cancel();
            job.clearConversation();
            log.info("Job {} removed from registry", id);
        }
        return Optional.ofNullable(job);
    }

    /** Remove terminal jobs that finished before {@code cutoff}. */
    public int evictFinishedBefore(Instant cutoff) {
        int evicted = 0;
        for (Job job : jobs.values()) {
            Instant finished = job.getFinishedAt();
            if (job.getStatus().isTerminal() && finished != null && finished.isBefore(cutoff)) {
                if (remove(job.getId()).isPresent()) evicted++;
            }
        }
        return evicted;
    }
}
