package org.example.learnpath.service.exception;

public class AttemptLimitExceededException extends RuntimeException {

    private final String questionId;
    private final int maxAttempts;

    public AttemptLimitExceededException(String questionId, int maxAttempts) {
        super("Question " + questionId + " allows at most " + maxAttempts + " attempts");
        this.questionId = questionId;
        this.maxAttempts = maxAttempts;
    }

    public String getQuestionId() {
        return questionId;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
