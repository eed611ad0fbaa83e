package org.example.learnpath.model;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Point-in-time view of one learner's progress through one course, read once per request.
 *
 * @param totalDays            course duration
 * @param questionIdsByDay     question ids keyed by day number; days without questions may be absent
 * @param answeredQuestionIds  ids of questions the learner has a progress record for
 */
public record CourseProgressSnapshot(
        int totalDays,
        Map<Integer, List<String>> questionIdsByDay,
        Set<String> answeredQuestionIds
) {
    public CourseProgressSnapshot {
        if (totalDays < 1) {
            throw new IllegalArgumentException("totalDays must be positive");
        }
        questionIdsByDay = questionIdsByDay == null ? Map.of() : Map.copyOf(questionIdsByDay);
        answeredQuestionIds = answeredQuestionIds == null ? Set.of() : Set.copyOf(answeredQuestionIds);
    }

    public List<String> questionIdsForDay(int dayNumber) {
        return questionIdsByDay.getOrDefault(dayNumber, List.of());
    }
}
