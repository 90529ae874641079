package com.codesmith.orchestrator.engine.conversation;

import com.codesmith.orchestrator.model.Question;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Publishes questions as {@link QuestionAskedEvent}s inside the application.
 * Transport adapters listen for the event; pollers read pending questions
 * from the job status instead.
 */
public class ApplicationEventQuestionChannel implements QuestionChannel {

    private static final Logger log = LoggerFactory.getLogger(ApplicationEventQuestionChannel.class);

    private final ApplicationEventPublisher publisher;

    public ApplicationEventQuestionChannel(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void publish(Question question) {
        log.info("Question {} for job {}: {} {}", question.id(), question.jobId(),
                question.prompt(), question.choices());
        publisher.publishEvent(new QuestionAskedEvent(question));
    }
}
