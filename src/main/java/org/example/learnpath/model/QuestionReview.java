package org.example.learnpath.model;

import java.util.List;

public record QuestionReview(
        String id,
        int dayNumber,
        String questionText,
        String difficulty,
        int points,
        List<String> options,
        String questionType,
        String codeSnippet,
        String correctAnswer,
        String explanation,
        String submittedAnswer,
        boolean correct,
        int earnedPoints
) {
}
