package com.codesmith.orchestrator.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client for a local Ollama server, used for the cheaper tiers.
 * Calls {@code POST /api/generate} with streaming off.
 */
@Component
public class OllamaClient extends JsonHttpClient {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GenerateResponse(String model, String response, boolean done) {}

    private final Duration timeout;

    public OllamaClient(@Value("${ollama.base-url:http://localhost:11434}") String baseUrl,
                        @Value("${ollama.timeout:PT300S}") Duration timeout,
                        ObjectMapper objectMapper) {
        super(baseUrl, objectMapper);
        this.timeout = timeout;
    }

    /**
     * @return the model's full reply
     * @throws ClientException on a non-2xx status, transport failure or empty reply
     */
    public String generate(String model, String system, String prompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model",  model);
        body.put("prompt", prompt);
        body.put("stream", false);
        if (system != null) {
            body.put("system", system);
        }
        String resp = post("/api/generate", body, "Ollama generate (" + model + ")", timeout);
        GenerateResponse parsed = parse(resp, GenerateResponse.class, "Ollama generate");
        if (parsed.response() == null || parsed.response().isBlank()) {
            throw new ClientException("Ollama model " + model + " returned an empty response");
        }
        return parsed.response();
    }
}
