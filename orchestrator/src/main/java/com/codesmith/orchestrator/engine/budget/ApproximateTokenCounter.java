package com.codesmith.orchestrator.engine.budget;

/**
 * Character-based estimate: one token per {@code charsPerToken} characters, rounded up.
 */
public class ApproximateTokenCounter implements TokenCounter {

    private final int charsPerToken;

    public ApproximateTokenCounter(int charsPerToken) {
        if (charsPerToken < 1) {
            throw new IllegalArgumentException("charsPerToken must be >= 1, got " + charsPerToken);
        }
        this.charsPerToken = charsPerToken;
    }

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (text.length() + charsPerToken - 1) / charsPerToken;
    }

    @Override
    public String truncate(String text, int maxTokens) {
        if (text == null || maxTokens <= 0) return "";
        long maxChars = (long) maxTokens * charsPerToken;
        if (text.length() <= maxChars) return text;
        int end = (int) maxChars;
        // Don't split a surrogate pair.
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) end--;
        return text.substring(0, end);
    }
}
