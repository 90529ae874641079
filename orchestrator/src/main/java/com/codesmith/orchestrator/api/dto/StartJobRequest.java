package com.codesmith.orchestrator.api.dto;

/**
 * Request body for POST /jobs.
 *
 * Required: task
 * Optional: language (defaults to codesmith.jobs.default-language),
 *           maxIterations (defaults to codesmith.jobs.default-max-iterations)
 */
public record StartJobRequest(String task, String language, Integer maxIterations) {}
