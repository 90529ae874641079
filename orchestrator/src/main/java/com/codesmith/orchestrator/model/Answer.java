package com.codesmith.orchestrator.model;

import java.time.Instant;

/**
 * The recorded answer to a {@link Question}. Immutable once recorded.
 */
public record Answer(String text, Source source, Instant answeredAt) {

    public enum Source {
        USER,       // delivered over the question channel
        DEFAULT     // timeout elapsed, question's default applied
    }
}
