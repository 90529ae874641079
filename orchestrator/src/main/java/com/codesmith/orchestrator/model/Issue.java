package com.codesmith.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One problem reported by the validator for a generated artifact.
 *
 * @param severity     e.g. "critical", "high", "warning", passed through as reported
 * @param location     file and/or line, free text; may be null
 * @param message      what is wrong
 * @param suggestedFix optional hint; may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Issue(String severity, String location, String message, String suggestedFix) {

    public Issue {
        if (severity == null || severity.isBlank()) severity = "info";
        if (message == null) message = "";
    }
}
