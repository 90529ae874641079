package com.codesmith.orchestrator.api.dto;

/** Request body for POST /jobs/{id}/questions/{questionId}/answer. */
public record AnswerRequest(String answer) {}
