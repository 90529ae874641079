package com.codesmith.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One knowledge-base search hit.
 *
 * @param source  where the snippet comes from (file path, doc id)
 * @param content snippet text
 * @param score   relevance, higher is better
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RankedSnippet(String source, String content, double score) {

    public RankedSnippet {
        if (content == null) content = "";
    }
}
