package org.example.learnpath.engine;

import org.example.learnpath.model.DayStatus;
import org.example.learnpath.model.ProgressSummary;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Rolls day statuses and point totals up into a course-level summary.
 */
@Component
public class ProgressAggregator {

    public static final String NO_ACTIVITY = "Never";

    public ProgressSummary summarize(
            String courseId,
            int totalDays,
            List<DayStatus> dayStatuses,
            int totalPoints,
            int earnedPoints) {
        int totalQuestions = 0;
        int answeredQuestions = 0;
        int completedDays = 0;
        for (DayStatus status : dayStatuses) {
            totalQuestions += status.totalQuestions();
            answeredQuestions += status.answeredQuestions();
            if (status.completed()) {
                completedDays++;
            }
        }
        double completionPercentage = totalQuestions == 0 ? 0.0 : answeredQuestions * 100.0 / totalQuestions;

        return new ProgressSummary(
                courseId,
                totalDays,
                totalQuestions,
                answeredQuestions,
                earnedPoints,
                totalPoints,
                completionPercentage,
                currentDay(totalDays, dayStatuses),
                completedDays
        );
    }

    /**
     * Lowest day that is unlocked and not completed; the last day once all are completed.
     */
    public int currentDay(int totalDays, List<DayStatus> dayStatuses) {
        if (dayStatuses.isEmpty()) {
            return 1;
        }
        boolean allCompleted = true;
        for (DayStatus status : dayStatuses) {
            if (status.current()) {
                return status.dayNumber();
            }
            allCompleted &= status.completed();
        }
        return allCompleted ? totalDays : 1;
    }

    public String describeLastActivity(LocalDateTime lastSubmittedAt) {
        return lastSubmittedAt == null ? NO_ACTIVITY : lastSubmittedAt.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }
}
