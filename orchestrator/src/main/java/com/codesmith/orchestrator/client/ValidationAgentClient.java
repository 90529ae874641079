package com.codesmith.orchestrator.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * HTTP client for the validation agent: builds, reviews and scores an artifact.
 * Calls {@code POST /api/agent/validate}.
 */
@Component
public class ValidationAgentClient extends JsonHttpClient implements CodeValidator {

    private static final Logger log = LoggerFactory.getLogger(ValidationAgentClient.class);

    private final Duration timeout;

    public ValidationAgentClient(@Value("${codesmith.validation.base-url:http://localhost:5003}") String baseUrl,
                                 @Value("${codesmith.validation.timeout:PT180S}") Duration timeout,
                                 ObjectMapper objectMapper) {
        super(baseUrl, objectMapper);
        this.timeout = timeout;
    }

    @Override
    public ValidationReport validate(String artifact, String language) {
        if (artifact == null || artifact.isBlank()) {
            throw new ClientException("Nothing to validate: artifact is empty");
        }
        String resp = post("/api/agent/validate",
                Map.of("code", artifact, "language", language),
                "validate (" + language + ")", timeout);
        ValidationReport report = parse(resp, ValidationReport.class, "validate");
        log.debug("Validation scored {}/10 with {} issues", report.score(), report.issues().size());
        return report;
    }
}
