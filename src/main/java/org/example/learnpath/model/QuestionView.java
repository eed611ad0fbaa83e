package org.example.learnpath.model;

import java.util.List;

/**
 * Question as shown to a learner working through an open day. Never carries the correct answer.
 */
public record QuestionView(
        String id,
        int dayNumber,
        String questionText,
        String difficulty,
        int points,
        List<String> options,
        String questionType,
        String codeSnippet,
        boolean answered
) {
}
