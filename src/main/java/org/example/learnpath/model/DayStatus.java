package org.example.learnpath.model;

public record DayStatus(
        int dayNumber,
        boolean unlocked,
        boolean completed,
        boolean current,
        int totalQuestions,
        int answeredQuestions,
        double completionPercentage,
        boolean canRegenerate,
        boolean hasQuestions,
        boolean hasProgress,
        boolean needsQuestions,
        boolean canContinue
) {
}
