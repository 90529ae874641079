package com.codesmith.orchestrator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Append-only log of a job's attempts.
 *
 * Written by the job's worker thread, read concurrently by status pollers.
 * Every append publishes a fresh immutable list, so a reader either sees an
 * attempt completely or not at all, and a later snapshot is never shorter
 * than an earlier one.
 */
public class AttemptHistory {

    private final Object writeLock = new Object();
    private volatile List<Attempt> attempts = List.of();

    /**
     * Append the next attempt.
     *
     * @throws IllegalStateException if the attempt number is not exactly size + 1
     */
    public void append(Attempt attempt) {
        synchronized (writeLock) {
            List<Attempt> current = attempts;
            int expected = current.size() + 1;
            if (attempt.number() != expected) {
                throw new IllegalStateException(
                        "Non-contiguous attempt number: expected " + expected + " but got " + attempt.number());
            }
            List<Attempt> next = new ArrayList<>(current.size() + 1);
            next.addAll(current);
            next.add(attempt);
            attempts = Collections.unmodifiableList(next);
        }
    }

    /** Immutable view of all attempts in order. Safe to hold on to. */
    public List<Attempt> snapshot() {
        return attempts;
    }

    public int size() {
        return attempts.size();
    }

    public boolean isEmpty() {
        return attempts.isEmpty();
    }

    public Optional<Attempt> latest() {
        List<Attempt> current = attempts;
        return current.isEmpty() ? Optional.empty() : Optional.of(current.get(current.size() - 1));
    }

    /** The last {@code n} attempts, most recent first. */
    public List<Attempt> recent(int n) {
        List<Attempt> current = attempts;
        List<Attempt> out = new ArrayList<>(Math.min(n, current.size()));
        for (int i = current.size() - 1; i >= 0 && out.size() < n; i--) {
            out.add(current.get(i));
        }
        return out;
    }

    /** Highest tier used so far, or empty before the first attempt. */
    public Optional<Tier> highestTier() {
        return highestTier(attempts);
    }

    public static Optional<Tier> highestTier(List<Attempt> attempts) {
        return attempts.stream().map(Attempt::tier).reduce(Tier::max);
    }

    public Optional<Attempt> best() {
        return best(attempts);
    }

    /**
     * Best attempt of a list.
     *
     * Highest score wins. On equal scores the cheaper tier wins; on equal
     * score and tier the later attempt wins.
     */
    public static Optional<Attempt> best(List<Attempt> attempts) {
        Attempt best = null;
        for (Attempt a : attempts) {
            if (best == null || isBetter(a, best)) {
                best = a;
            }
        }
        return Optional.ofNullable(best);
    }

    private static boolean isBetter(Attempt candidate, Attempt incumbent) {
        int byScore = Double.compare(candidate.score(), incumbent.score());
        if (byScore != 0) return byScore > 0;
        if (candidate.tier() != incumbent.tier()) {
            return incumbent.tier().isMoreExpensiveThan(candidate.tier());
        }
        return candidate.number() > incumbent.number();
    }
}
