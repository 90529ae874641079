package com.codesmith.orchestrator.api.dto;

import com.codesmith.orchestrator.model.Answer;
import com.codesmith.orchestrator.model.Question;
import com.codesmith.orchestrator.model.QuestionView;

import java.time.Instant;
import java.util.List;

/**
 * A clarifying question and, once resolved, its answer.
 * answerSource is USER or DEFAULT; both answer fields are null while pending
 * and after the question expired.
 */
public record QuestionResponse(
        String       id,
        String       prompt,
        List<String> choices,
        String       defaultAnswer,
        String       category,
        Instant      createdAt,
        boolean      pending,
        boolean      expired,
        String       answer,
        Answer.Source answerSource
) {
    public static QuestionResponse from(QuestionView view) {
        Question q = view.question();
        Answer a = view.answer();
        return new QuestionResponse(
                q.id(),
                q.prompt(),
                q.choices(),
                q.defaultAnswer(),
                q.category(),
                q.createdAt(),
                view.isPending(),
                view.isExpired(),
                a == null ? null : a.text(),
                a == null ? null : a.source()
        );
    }
}
