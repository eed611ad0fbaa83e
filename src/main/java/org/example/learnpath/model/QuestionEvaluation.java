package org.example.learnpath.model;

import java.util.List;
import java.util.Map;

/**
 * @param overallScore        0 to 100
 * @param detailedFeedback    per-criterion feedback, e.g. {@code clarity -> {score, comments}}
 */
public record QuestionEvaluation(
        int overallScore,
        String grade,
        Map<String, Map<String, Object>> detailedFeedback,
        List<String> recommendations,
        List<String> strengths,
        List<String> areasForImprovement
) {
}
