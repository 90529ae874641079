package com.codesmith.orchestrator.engine.escalation;

import com.codesmith.orchestrator.config.CodesmithProperties;
import com.codesmith.orchestrator.model.Attempt;
import com.codesmith.orchestrator.model.AttemptHistory;
import com.codesmith.orchestrator.model.EscalationDecision;
import com.codesmith.orchestrator.model.EscalationDecision.Abort;
import com.codesmith.orchestrator.model.EscalationDecision.Accept;
import com.codesmith.orchestrator.model.EscalationDecision.Retry;
import com.codesmith.orchestrator.model.TerminalReason;
import com.codesmith.orchestrator.model.Tier;

import java.util.List;

/**
 * Decides what happens after each attempt.
 *
 * Rules, checked in order:
 * <ol>
 *   <li>score ≥ highBar → accept, whatever the attempt number;</li>
 *   <li>score ≥ acceptableBar and attempt ≥ minAttemptsBeforeAccept → accept;</li>
 *   <li>attempt ≥ maxIterations → abort;</li>
 *   <li>otherwise retry on the tier for the next attempt number, never lower
 *       than any tier already used.</li>
 * </ol>
 *
 * <p>The policy is a pure function: it reads the history and never changes it.
 */
public class EscalationPolicy {

    private final double highBar;
    private final double acceptableBar;
    private final int    minAttemptsBeforeAccept;
    private final int[]  tierBoundaries;

    /**
     * @param tierBoundaries first attempt number of each tier above {@link Tier#LOCAL},
     *                       ascending; one entry per extra tier
     */
    public EscalationPolicy(double highBar, double acceptableBar,
                            int minAttemptsBeforeAccept, List<Integer> tierBoundaries) {
        if (acceptableBar > highBar) {
            throw new IllegalArgumentException(
                    "acceptableBar (" + acceptableBar + ") must not exceed highBar (" + highBar + ")");
        }
        if (tierBoundaries.size() >= Tier.values().length) {
            throw new IllegalArgumentException("At most " + (Tier.values().length - 1)
                    + " tier boundaries for " + Tier.values().length + " tiers");
        }
        int previous = 1;
        for (int boundary : tierBoundaries) {
            if (boundary <= previous) {
                throw new IllegalArgumentException("Tier boundaries must be ascending and > 1: " + tierBoundaries);
            }
            previous = boundary;
        }
        this.highBar                 = highBar;
        this.acceptableBar           = acceptableBar;
        this.minAttemptsBeforeAccept = minAttemptsBeforeAccept;
        this.tierBoundaries          = tierBoundaries.stream().mapToInt(Integer::intValue).toArray();
    }

    public static EscalationPolicy from(CodesmithProperties.Escalation props) {
        return new EscalationPolicy(props.getHighBar(), props.getAcceptableBar(),
                props.getMinAttemptsBeforeAccept(), props.getTierBoundaries());
    }

    /**
     * Evaluate the latest attempt.
     *
     * @param attemptNumber number of the attempt just scored (1-based)
     * @param latestScore   its score
     * @param history       all attempts so far, ending with that attempt
     * @param maxIterations attempt budget of the job
     */
    public EscalationDecision decide(int attemptNumber, double latestScore,
                                     List<Attempt> history, int maxIterations) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1, got " + attemptNumber);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1, got " + maxIterations);
        }
        if (!history.isEmpty() && history.get(history.size() - 1).number() != attemptNumber) {
            throw new IllegalStateException("Policy asked about attempt " + attemptNumber
                    + " but history ends at attempt " + history.get(history.size() - 1).number());
        }

        if (latestScore >= highBar) {
            return new Accept(TerminalReason.ACCEPTED_HIGH_SCORE);
        }
        if (latestScore >= acceptableBar && attemptNumber >= minAttemptsBeforeAccept) {
            return new Accept(TerminalReason.ACCEPTED_GOOD_ENOUGH);
        }
        if (attemptNumber >= maxIterations) {
            return new Abort(TerminalReason.MAX_ATTEMPTS_EXHAUSTED,
                    TerminalReason.MAX_ATTEMPTS_EXHAUSTED.description());
        }

        Tier scheduled = tierFor(attemptNumber + 1);
        return new Retry(AttemptHistory.highestTier(history)
                .map(used -> Tier.max(scheduled, used))
                .orElse(scheduled));
    }

    /** Tier scheduled for a given attempt number, ignoring history. */
    public Tier tierFor(int attemptNumber) {
        Tier[] tiers = Tier.values();
        int index = 0;
        for (int boundary : tierBoundaries) {
            if (attemptNumber >= boundary) index++;
        }
        return tiers[index];
    }
}
