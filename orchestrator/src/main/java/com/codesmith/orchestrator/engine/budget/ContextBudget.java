package com.codesmith.orchestrator.engine.budget;

import com.codesmith.orchestrator.config.CodesmithProperties;

/**
 * Token ceiling for one prompt and its split into buckets.
 *
 * Generation is the room left for the model's own answer and reserve is
 * headroom; neither is ever filled with prompt text.
 */
public record ContextBudget(
        int totalTokens,
        int overviewTokens,
        int summaryTokens,
        int explorationTokens,
        int generationTokens,
        int reserveTokens,
        int minOverviewTokens
) {
    public ContextBudget {
        if (totalTokens < 0 || overviewTokens < 0 || summaryTokens < 0 || explorationTokens < 0
                || generationTokens < 0 || reserveTokens < 0 || minOverviewTokens < 0) {
            throw new IllegalArgumentException("Budget values must be non-negative");
        }
        long sum = (long) overviewTokens + summaryTokens + explorationTokens + generationTokens + reserveTokens;
        if (sum > totalTokens) {
            throw new IllegalArgumentException(
                    "Sub-allotments (" + sum + ") exceed the total ceiling (" + totalTokens + ")");
        }
    }

    /**
     * Split {@code totalTokens} by shares. The overview bucket never drops below
     * {@code minOverviewTokens} while the total allows it; whatever the shares
     * leave over becomes the reserve.
     */
    public static ContextBudget split(int totalTokens, int minOverviewTokens,
                                      double overviewShare, double summaryShare,
                                      double explorationShare, double generationShare) {
        int remaining = totalTokens;

        int overview = Math.min(remaining, Math.max(minOverviewTokens, share(totalTokens, overviewShare)));
        remaining -= overview;
        int summary = Math.min(remaining, share(totalTokens, summaryShare));
        remaining -= summary;
        int exploration = Math.min(remaining, share(totalTokens, explorationShare));
        remaining -= exploration;
        int generation = Math.min(remaining, share(totalTokens, generationShare));
        remaining -= generation;

        return new ContextBudget(totalTokens, overview, summary, exploration, generation, remaining,
                minOverviewTokens);
    }

    public static ContextBudget from(CodesmithProperties.Budget props) {
        return split(props.getTotalTokens(), props.getMinOverviewTokens(),
                props.getOverviewShare(), props.getSummaryShare(),
                props.getExplorationShare(), props.getGenerationShare());
    }

    /** Tokens available for prompt text. */
    public int promptCeiling() {
        return overviewTokens + summaryTokens + explorationTokens;
    }

    private static int share(int total, double fraction) {
        return (int) Math.floor(total * Math.max(0.0, fraction));
    }
}
