package com.codesmith.orchestrator.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A clarifying question published to a human while a job waits.
 *
 * @param defaultAnswer used when nobody answers before the timeout; null means
 *                      the job cannot proceed without a real answer
 */
public record Question(
        String       id,
        UUID         jobId,
        String       prompt,
        List<String> choices,
        String       defaultAnswer,
        String       category,
        Instant      createdAt
) {
    public Question {
        choices = choices == null ? List.of() : List.copyOf(choices);
    }

    public static String newId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public boolean hasDefault() {
        return defaultAnswer != null && !defaultAnswer.isBlank();
    }
}
