package com.codesmith.orchestrator.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API, used for the premium tier.
 *
 * Single-turn only: the orchestrator sends one fully assembled prompt per
 * attempt and keeps history itself.
 */
@Component
public class ClaudeClient extends JsonHttpClient {

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** role is "user" or "assistant". */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content, String model) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        public String firstText() {
            if (content == null) {
                throw new ClientException("Claude response has no content");
            }
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new ClientException("No text block in Claude response"));
        }
    }

    private static final String API_VER    = "2023-06-01";
    private static final int    MAX_TOKENS = 8192;

    private final String   apiKey;
    private final Duration timeout;

    public ClaudeClient(@Value("${anthropic.base-url:https://api.anthropic.com}") String baseUrl,
                        @Value("${anthropic.api-key:}") String apiKey,
                        @Value("${anthropic.timeout:PT120S}") Duration timeout,
                        ObjectMapper objectMapper) {
        super(baseUrl, objectMapper);
        this.apiKey  = apiKey;
        this.timeout = timeout;
    }

    /**
     * Send one user message and return the assistant's text reply.
     *
     * @param model  e.g. "claude-sonnet-4-5"
     * @param system system prompt; may be null
     * @throws ClientException on a non-2xx status or transport failure
     */
    public String complete(String model, String system, String userMessage) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ClientException("anthropic.api-key is not configured");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model",      model);
        body.put("max_tokens", MAX_TOKENS);
        if (system != null) {
            body.put("system", system);
        }
        body.put("messages", List.of(new Message("user", userMessage)));

        String resp = post("/v1/messages", body, "Claude completion (" + model + ")", timeout,
                Map.of("x-api-key", apiKey, "anthropic-version", API_VER));
        return parse(resp, MessagesResponse.class, "Claude completion").firstText();
    }
}
