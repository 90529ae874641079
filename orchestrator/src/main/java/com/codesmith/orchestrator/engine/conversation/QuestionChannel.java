package com.codesmith.orchestrator.engine.conversation;

import com.codesmith.orchestrator.model.Question;

/**
 * Outbound half of the human channel. Answers come back through
 * {@link com.codesmith.orchestrator.service.JobService#submitAnswer}.
 */
public interface QuestionChannel {

    void publish(Question question);
}
