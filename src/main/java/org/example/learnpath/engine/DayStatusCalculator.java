package org.example.learnpath.engine;

import org.example.learnpath.model.CourseProgressSnapshot;
import org.example.learnpath.model.DayStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives unlock and completion state for course days from a progress snapshot.
 * <p>
 * Day 1 is always unlocked; day d+1 is unlocked exactly when day d is completed. A day is completed
 * once it has at least one question and the learner has answered every one of them.
 */
@Component
public class DayStatusCalculator {

    /**
     * Status of every day, computed in one ascending pass so each day's unlock flag reuses the
     * completion of the day before.
     */
    public List<DayStatus> computeAll(CourseProgressSnapshot snapshot) {
        List<DayStatus> statuses = new ArrayList<>(snapshot.totalDays());
        boolean previousCompleted = true;
        for (int day = 1; day <= snapshot.totalDays(); day++) {
            DayStatus status = evaluate(snapshot, day, day == 1 || previousCompleted);
            statuses.add(status);
            previousCompleted = status.completed();
        }
        return List.copyOf(statuses);
    }

    public DayStatus compute(CourseProgressSnapshot snapshot, int dayNumber) {
        validateDay(snapshot, dayNumber);
        boolean unlocked = true;
        for (int day = 1; day < dayNumber; day++) {
            if (!isCompleted(snapshot, day)) {
                unlocked = false;
                break;
            }
        }
        return evaluate(snapshot, dayNumber, unlocked);
    }

    public void validateDay(CourseProgressSnapshot snapshot, int dayNumber) {
        if (dayNumber < 1 || dayNumber > snapshot.totalDays()) {
            throw new IllegalArgumentException(
                    "Day number must be between 1 and " + snapshot.totalDays() + " but was " + dayNumber);
        }
    }

    private DayStatus evaluate(CourseProgressSnapshot snapshot, int dayNumber, boolean unlocked) {
        List<String> questionIds = snapshot.questionIdsForDay(dayNumber);
        int total = questionIds.size();
        int answered = countAnswered(snapshot, questionIds);

        boolean completed = total > 0 && answered == total;
        boolean hasQuestions = total > 0;
        boolean hasProgress = answered > 0;
        double completionPercentage = total == 0 ? 0.0 : answered * 100.0 / total;

        return new DayStatus(
                dayNumber,
                unlocked,
                completed,
                unlocked && !completed,
                total,
                answered,
                completionPercentage,
                unlocked && hasQuestions && !completed,
                hasQuestions,
                hasProgress,
                unlocked && !hasQuestions,
                unlocked && hasQuestions && hasProgress && !completed
        );
    }

    private boolean isCompleted(CourseProgressSnapshot snapshot, int dayNumber) {
        List<String> questionIds = snapshot.questionIdsForDay(dayNumber);
        return !questionIds.isEmpty() && countAnswered(snapshot, questionIds) == questionIds.size();
    }

    private int countAnswered(CourseProgressSnapshot snapshot, List<String> questionIds) {
        int answered = 0;
        for (String questionId : questionIds) {
            if (snapshot.answeredQuestionIds().contains(questionId)) {
                answered++;
            }
        }
        return answered;
    }
}
