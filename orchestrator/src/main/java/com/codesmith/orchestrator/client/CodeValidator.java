package com.codesmith.orchestrator.client;

import com.codesmith.orchestrator.model.Issue;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Scores a generated artifact.
 */
public interface CodeValidator {

    ValidationReport validate(String artifact, String language);

    /**
     * @param score       0..10, higher is better; NaN is read as 0
     * @param buildErrors compiler output if the artifact did not build; may be null
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ValidationReport(double score, List<Issue> issues, String buildErrors, String summary) {
        public ValidationReport {
            issues = issues == null ? List.of() : List.copyOf(issues);
            score  = Double.isNaN(score) ? 0.0 : Math.max(0.0, Math.min(10.0, score));
        }
    }
}
