package com.codesmith.orchestrator.engine.budget;

import com.codesmith.orchestrator.model.RankedSnippet;

import java.util.List;

/**
 * Candidate prompt content before budgeting.
 *
 * @param overview    always-included text: task, language, clarifications
 * @param snippets    knowledge-base hits, best first
 * @param exploration transcript entries, oldest first
 */
public record PromptInputs(String overview, List<RankedSnippet> snippets, List<String> exploration) {

    public PromptInputs {
        if (overview == null) overview = "";
        snippets    = snippets == null ? List.of() : List.copyOf(snippets);
        exploration = exploration == null ? List.of() : List.copyOf(exploration);
    }
}
