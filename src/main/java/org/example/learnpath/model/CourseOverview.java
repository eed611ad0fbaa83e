package org.example.learnpath.model;

public record CourseOverview(
        String courseId,
        String courseName,
        String description,
        int durationDays,
        boolean custom,
        int currentDay,
        double completionPercentage,
        int earnedPoints,
        int totalPoints,
        int completedDays,
        String lastActivity
) {
}
