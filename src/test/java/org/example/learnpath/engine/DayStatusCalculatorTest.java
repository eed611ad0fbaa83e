package org.example.learnpath.engine;

import org.example.learnpath.model.CourseProgressSnapshot;
import org.example.learnpath.model.DayStatus;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DayStatusCalculatorTest {

    private final DayStatusCalculator calculator = new DayStatusCalculator();

    private static final Map<Integer, List<String>> FIVE_DAY_QUESTIONS = Map.of(
            1, List.of("q1a", "q1b"),
            2, List.of("q2a", "q2b"),
            3, List.of("q3a"),
            4, List.of("q4a", "q4b")
    );

    @Test
    void computeAll_unlockFollowsCompletionOfPreviousDay() {
        Set<String> answered = Set.of("q1a", "q1b", "q2a", "q2b", "q3a", "q4a");
        CourseProgressSnapshot snapshot = new CourseProgressSnapshot(5, FIVE_DAY_QUESTIONS, answered);

        List<DayStatus> statuses = calculator.computeAll(snapshot);

        assertEquals(5, statuses.size());
        assertTrue(statuses.get(0).unlocked());
        for (int i = 1; i < statuses.size(); i++) {
            assertEquals(statuses.get(i - 1).completed(), statuses.get(i).unlocked(), "day " + (i + 1));
        }
        assertTrue(statuses.get(2).completed());
        assertTrue(statuses.get(3).current());
        assertTrue(statuses.get(3).canContinue());
        assertEquals(50.0, statuses.get(3).completionPercentage(), 0.0001);
        assertFalse(statuses.get(4).unlocked());
        assertFalse(statuses.get(4).needsQuestions());
    }

    @Test
    void computeAll_matchesSingleDayComputationForEveryProgressPrefix() {
        List<String> order = List.of("q1a", "q1b", "q2a", "q2b", "q3a", "q4a", "q4b");
        Set<String> answered = new HashSet<>();
        for (int step = 0; step <= order.size(); step++) {
            CourseProgressSnapshot snapshot = new CourseProgressSnapshot(5, FIVE_DAY_QUESTIONS, answered);
            List<DayStatus> all = calculator.computeAll(snapshot);
            for (int day = 1; day <= 5; day++) {
                assertEquals(all.get(day - 1), calculator.compute(snapshot, day), "step " + step + " day " + day);
            }
            if (step < order.size()) {
                answered.add(order.get(step));
            }
        }
    }

    @Test
    void compute_freshCourse_onlyDayOneIsOpen() {
        CourseProgressSnapshot snapshot = new CourseProgressSnapshot(3, Map.of(), Set.of());

        DayStatus dayOne = calculator.compute(snapshot, 1);
        DayStatus dayTwo = calculator.compute(snapshot, 2);

        assertTrue(dayOne.unlocked());
        assertTrue(dayOne.current());
        assertTrue(dayOne.needsQuestions());
        assertFalse(dayOne.canRegenerate());
        assertEquals(0.0, dayOne.completionPercentage());

        assertFalse(dayTwo.unlocked());
        assertFalse(dayTwo.canRegenerate());
        assertFalse(dayTwo.needsQuestions());
        assertFalse(dayTwo.current());
    }

    @Test
    void compute_dayWithoutQuestionsIsNeverCompleted() {
        CourseProgressSnapshot snapshot = new CourseProgressSnapshot(2, Map.of(2, List.of("q2a")), Set.of("q2a"));

        DayStatus dayOne = calculator.compute(snapshot, 1);
        DayStatus dayTwo = calculator.compute(snapshot, 2);

        assertFalse(dayOne.completed());
        assertFalse(dayTwo.unlocked());
    }

    @Test
    void compute_openDayWithQuestionsCanBeRegenerated() {
        CourseProgressSnapshot snapshot = new CourseProgressSnapshot(2, Map.of(1, List.of("q1a", "q1b")), Set.of("q1a"));

        DayStatus status = calculator.compute(snapshot, 1);

        assertTrue(status.canRegenerate());
        assertTrue(status.hasProgress());
        assertEquals(1, status.answeredQuestions());
        assertEquals(2, status.totalQuestions());
    }

    @Test
    void compute_dayOutOfRange_throws() {
        CourseProgressSnapshot snapshot = new CourseProgressSnapshot(3, Map.of(), Set.of());

        assertThrows(IllegalArgumentException.class, () -> calculator.compute(snapshot, 0));
        assertThrows(IllegalArgumentException.class, () -> calculator.compute(snapshot, 4));
    }
}
