package org.example.learnpath.model;

public record ProgressSummary(
        String courseId,
        int totalDays,
        int totalQuestions,
        int answeredQuestions,
        int earnedPoints,
        int totalPoints,
        double completionPercentage,
        int currentDay,
        int completedDays
) {
}
