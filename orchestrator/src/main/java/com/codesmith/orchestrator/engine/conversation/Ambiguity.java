package com.codesmith.orchestrator.engine.conversation;

import java.util.List;

/**
 * An underspecified decision found in a task.
 *
 * @param term          what is ambiguous, e.g. "authentication"
 * @param question      question to put to the user
 * @param choices       suggested answers; may be empty for free text
 * @param defaultAnswer used when nobody answers in time; null if there is none
 * @param category      grouping shown to the user
 */
public record Ambiguity(String term, String question, List<String> choices,
                        String defaultAnswer, String category) {

    public Ambiguity {
        choices = choices == null ? List.of() : List.copyOf(choices);
    }
}
