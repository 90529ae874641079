package com.codesmith.orchestrator.client;

import com.codesmith.orchestrator.model.RankedSnippet;

import java.util.List;

/**
 * Semantic search over the project knowledge base (vector and graph stores).
 */
public interface KnowledgeSearch {

    /** Up to {@code limit} snippets relevant to {@code query}, best first. */
    List<RankedSnippet> search(String query, int limit);
}
