package com.codesmith.orchestrator.api.dto;

/** Request body for POST /jobs/{id}/feedback. */
public record FeedbackRequest(String message) {}
