package org.example.learnpath.model;

import java.util.List;

/**
 * A fully populated question ready to be persisted. Options carry their "X) " labels.
 */
public record QuestionDraft(
        String questionText,
        String difficulty,
        int points,
        String correctAnswer,
        List<String> options,
        String explanation,
        String questionType,
        String codeSnippet
) {
    public QuestionDraft {
        options = options == null ? List.of() : List.copyOf(options);
    }
}
