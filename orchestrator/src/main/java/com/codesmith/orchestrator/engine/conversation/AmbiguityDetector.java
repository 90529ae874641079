package com.codesmith.orchestrator.engine.conversation;

import java.util.List;

/**
 * Classifier that decides whether a task needs a clarifying question
 * before the first attempt.
 */
public interface AmbiguityDetector {

    /** Ambiguities in priority order; empty when the task is clear enough. */
    List<Ambiguity> detect(String task, String language);
}
