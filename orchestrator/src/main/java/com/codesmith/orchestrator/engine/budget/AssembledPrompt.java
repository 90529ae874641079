package com.codesmith.orchestrator.engine.budget;

import java.util.List;
import java.util.Map;

/**
 * Budgeted prompt plus what had to go to get it under the ceiling.
 *
 * @param usage   tokens spent per bucket
 * @param dropped one line per dropped or truncated input, for diagnostics
 */
public record AssembledPrompt(String text, int tokens, Map<Bucket, Integer> usage, List<String> dropped) {

    public enum Bucket { OVERVIEW, SUMMARIES, EXPLORATION, GENERATION, RESERVE }

    public AssembledPrompt {
        usage   = Map.copyOf(usage);
        dropped = List.copyOf(dropped);
    }
}
