package com.codesmith.orchestrator.model;

import java.time.Instant;

/** Free-form guidance a human sent to a running job without being asked. */
public record Feedback(String message, Instant receivedAt) {}
