package org.example.learnpath.model;

import java.util.List;

/**
 * Result of one question-generation attempt. {@code questions} is never empty.
 */
public record GenerationOutcome(
        List<QuestionDraft> questions,
        boolean fallbackUsed,
        String modelName,
        String failureReason,
        long durationMs
) {
    public GenerationOutcome {
        questions = questions == null ? List.of() : List.copyOf(questions);
    }
}
