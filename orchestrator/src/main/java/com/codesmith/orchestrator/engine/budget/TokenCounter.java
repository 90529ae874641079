package com.codesmith.orchestrator.engine.budget;

/**
 * Measures and cuts text in model tokens.
 *
 * Implementations must be subadditive: count(a + b) ≤ count(a) + count(b).
 * The allocator relies on this to bound the assembled prompt by the sum of
 * its sections.
 */
public interface TokenCounter {

    int count(String text);

    /** Longest prefix of {@code text} whose count is at most {@code maxTokens}. */
    String truncate(String text, int maxTokens);
}
