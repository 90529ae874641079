package com.codesmith.orchestrator.model;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One code-generation task submitted by a caller.
 *
 * A Job lives in the {@link com.codesmith.orchestrator.engine.JobRegistry}
 * until it is cleaned up. Its attempt loop runs on a single worker thread;
 * other threads only read snapshots, cancel it, or deliver answers.
 *
 * Status, timestamps and result change together through one atomic
 * reference, so a reader never sees a terminal status without its result.
 */
public class Job {

    private record Lifecycle(JobStatus status, Instant startedAt, Instant finishedAt, JobResult result) {}

    private final UUID    id;
    private final String  task;
    private final String  language;
    private final int     maxIterations;
    private final Instant createdAt;
    private final Clock   clock;

    private final CancellationToken cancellation = new CancellationToken();
    private final AttemptHistory    history      = new AttemptHistory();
    private final AtomicReference<Lifecycle> lifecycle =
            new AtomicReference<>(new Lifecycle(JobStatus.PENDING, null, null, null));

    // Tier the next attempt will run on. Only the worker thread writes it.
    private volatile Tier currentTier = Tier.cheapest();

    // Created on the first question or feedback message.
    private volatile ConversationState conversation;

    public Job(UUID id, String task, String language, int maxIterations, Clock clock) {
        if (task == null || task.isBlank()) {
            throw new IllegalArgumentException("task must not be blank");
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        this.id            = id;
        this.task          = task;
        this.language      = language;
        this.maxIterations = maxIterations;
        this.clock         = clock;
        this.createdAt     = clock.instant();
    }

    // ------------------------------------------------------------------
    // State transitions
    // ------------------------------------------------------------------

    /** PENDING → RUNNING. Returns false if the job was cancelled before a worker got to it. */
    public boolean markRunning() {
        Lifecycle current = lifecycle.get();
        if (!current.status().canTransitionTo(JobStatus.RUNNING)) {
            return false;
        }
        return lifecycle.compareAndSet(current,
                new Lifecycle(JobStatus.RUNNING, clock.instant(), null, null));
    }

    /**
     * Enter the terminal state implied by {@code result}.
     *
     * @return true if this call finished the job; false if it was already terminal
     */
    public boolean finish(JobResult result) {
        JobStatus target = result.status();
        while (true) {
            Lifecycle current = lifecycle.get();
            if (!current.status().canTransitionTo(target)) {
                return false;
            }
            Lifecycle next = new Lifecycle(target, current.startedAt(), clock.instant(), result);
            if (lifecycle.compareAndSet(current, next)) {
                return true;
            }
        }
    }

    /**
     * Finish a job that no worker has started yet. Does nothing once the job
     * is running, so the worker stays the only writer of a running job.
     */
    public boolean finishIfPending(JobResult result) {
        Lifecycle current = lifecycle.get();
        if (current.status() != JobStatus.PENDING || !JobStatus.PENDING.canTransitionTo(result.status())) {
            return false;
        }
        return lifecycle.compareAndSet(current,
                new Lifecycle(result.status(), null, clock.instant(), result));
    }

    public void escalateTo(Tier tier) {
        this.currentTier = Tier.max(currentTier, tier);
    }

    // ------------------------------------------------------------------
    // Conversation
    // ------------------------------------------------------------------

    public ConversationState conversation() {
        ConversationState state = conversation;
        if (state == null) {
            synchronized (this) {
                state = conversation;
                if (state == null) {
                    state = new ConversationState(clock);
                    conversation = state;
                }
            }
        }
        return state;
    }

    public Optional<ConversationState> existingConversation() {
        return Optional.ofNullable(conversation);
    }

    /** Drop conversation state; later questions or feedback start a fresh one. */
    public synchronized void clearConversation() {
        conversation = null;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID              getId()            { return id; }
    public String            getTask()          { return task; }
    public String            getLanguage()      { return language; }
    public int               getMaxIterations() { return maxIterations; }
    public Instant           getCreatedAt()     { return createdAt; }
    public CancellationToken getCancellation()  { return cancellation; }
    public AttemptHistory    getHistory()       { return history; }
    public Tier              getCurrentTier()   { return currentTier; }

    public JobStatus         getStatus()        { return lifecycle.get().status(); }
    public Instant           getStartedAt()     { return lifecycle.get().startedAt(); }
    public Instant           getFinishedAt()    { return lifecycle.get().finishedAt(); }
    public Optional<JobResult> getResult()      { return Optional.ofNullable(lifecycle.get().result()); }

    /** Consistent read-only copy for status readers. */
    public JobSnapshot snapshot() {
        Lifecycle current = lifecycle.get();
        ConversationState conv = conversation;
        return JobSnapshot.of(this, current.status(), current.startedAt(), current.finishedAt(),
                current.result(), history.snapshot(),
                conv == null ? List.of() : conv.snapshot(),
                conv == null ? List.of() : conv.feedback());
    }
}
