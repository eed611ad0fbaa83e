package org.example.learnpath.model;

import java.util.List;

/**
 * Learner-supplied framing for a regenerated question set.
 *
 * @param difficultyPreference one of "easier", "balanced", "harder"; null means balanced
 */
public record RegenerationPreferences(
        List<String> focusAreas,
        String difficultyPreference,
        List<String> questionTypes,
        String specialInstructions,
        Integer numQuestions
) {
    public RegenerationPreferences {
        focusAreas = focusAreas == null ? List.of() : List.copyOf(focusAreas);
        questionTypes = questionTypes == null ? List.of() : List.copyOf(questionTypes);
    }

    public static RegenerationPreferences defaults() {
        return new RegenerationPreferences(List.of(), null, List.of(), null, null);
    }
}
