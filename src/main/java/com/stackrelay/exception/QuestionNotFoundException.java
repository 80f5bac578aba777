package com.stackrelay.exception;

/**
 * The requested question id returned no items.
 */
public class QuestionNotFoundException extends StackApiException {

    private final long questionId;

    public QuestionNotFoundException(long questionId) {
        super("Question " + questionId + " not found");
        this.questionId = questionId;
    }

    public long getQuestionId() {
        return questionId;
    }
}
