package com.codesmith.orchestrator.client;

import com.codesmith.orchestrator.model.RankedSnippet;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the memory agent's semantic search tool.
 * Calls {@code POST /api/mcp/call} with the {@code smartsearch} tool.
 */
@Component
public class MemoryAgentClient extends JsonHttpClient implements KnowledgeSearch {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SearchResponse(List<RankedSnippet> results) {}

    private final Duration timeout;

    public MemoryAgentClient(@Value("${codesmith.memory.base-url:http://localhost:5000}") String baseUrl,
                             @Value("${codesmith.memory.timeout:PT30S}") Duration timeout,
                             ObjectMapper objectMapper) {
        super(baseUrl, objectMapper);
        this.timeout = timeout;
    }

    @Override
    public List<RankedSnippet> search(String query, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Map<String, Object> request = Map.of(
                "name",      "smartsearch",
                "arguments", Map.of("query", query, "limit", limit));
        SearchResponse resp = parse(post("/api/mcp/call", request, "memory search", timeout),
                SearchResponse.class, "memory search");
        if (resp.results() == null) {
            return List.of();
        }
        return resp.results().stream()
                .sorted(Comparator.comparingDouble(RankedSnippet::score).reversed())
                .limit(limit)
                .toList();
    }
}
