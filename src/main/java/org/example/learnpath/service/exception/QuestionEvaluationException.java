package org.example.learnpath.service.exception;

/**
 * The LLM could not produce a usable quality review for a question.
 */
public class QuestionEvaluationException extends RuntimeException {

    public static final String USER_MESSAGE = "Failed to evaluate question. Please try again.";

    private final String detail;

    public QuestionEvaluationException(String detail) {
        this(detail, null);
    }

    public QuestionEvaluationException(String detail, Throwable cause) {
        super(USER_MESSAGE, cause);
        this.detail = detail;
    }

    public String getDetail() {
        return detail;
    }
}
