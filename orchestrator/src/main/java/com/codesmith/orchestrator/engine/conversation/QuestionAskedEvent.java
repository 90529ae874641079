package com.codesmith.orchestrator.engine.conversation;

import com.codesmith.orchestrator.model.Question;

/** Spring application event fired when a job publishes a question. */
public record QuestionAskedEvent(Question question) {}
