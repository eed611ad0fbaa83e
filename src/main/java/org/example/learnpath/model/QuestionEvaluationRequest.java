package org.example.learnpath.model;

import java.util.List;

/**
 * A generated question submitted for an LLM quality review. Missing framing fields take the
 * defaults applied in the compact constructor.
 */
public record QuestionEvaluationRequest(
        String courseName,
        Integer dayNumber,
        String questionType,
        String difficulty,
        String question,
        List<String> options,
        String correctAnswer,
        String explanation,
        String codeSnippet
) {
    public QuestionEvaluationRequest {
        courseName = courseName == null || courseName.isBlank() ? "Programming Course" : courseName.strip();
        dayNumber = dayNumber == null ? 1 : dayNumber;
        questionType = questionType == null || questionType.isBlank() ? "conceptual" : questionType.strip();
        difficulty = difficulty == null || difficulty.isBlank() ? "beginner" : difficulty.strip();
        options = options == null ? List.of() : List.copyOf(options);
        correctAnswer = correctAnswer == null ? "" : correctAnswer.strip();
        explanation = explanation == null ? "" : explanation.strip();
    }
}
