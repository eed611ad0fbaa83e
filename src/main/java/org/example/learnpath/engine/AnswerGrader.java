package org.example.learnpath.engine;

import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Binary grading: a submission earns the question's full points or nothing.
 */
@Component
public class AnswerGrader {

    public GradeResult grade(String submitted, String correctAnswer, int points) {
        if (submitted == null || correctAnswer == null) {
            return new GradeResult(false, 0);
        }
        boolean correct = normalize(submitted).equals(normalize(correctAnswer));
        return new GradeResult(correct, correct ? points : 0);
    }

    public String normalize(String answer) {
        return answer == null ? "" : answer.strip().toUpperCase(Locale.ROOT);
    }

    public String feedback(GradeResult result, String correctAnswer) {
        return result.correct()
                ? "Correct! Well done!"
                : "Incorrect. The correct answer is: " + correctAnswer;
    }

    public record GradeResult(boolean correct, int earnedPoints) {
    }
}
