package org.example.learnpath.model;

public record AnswerResult(
        String questionId,
        boolean correct,
        int earnedPoints,
        String correctAnswer,
        String explanation,
        String feedback,
        int attemptCount
) {
}
