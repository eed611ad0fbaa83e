package org.example.learnpath.engine;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.learnpath.model.QuestionDraft;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Repairs a raw question object from the LLM into a complete {@link QuestionDraft}.
 * Every field gets a default; nothing here throws on bad input.
 */
@Component
public class QuestionPayloadNormalizer {

    static final String PLACEHOLDER_PREFIX = "Sample question";
    static final int DEFAULT_POINTS = 10;
    static final String DEFAULT_DIFFICULTY = "beginner";
    static final String DEFAULT_QUESTION_TYPE = "conceptual";
    static final String DEFAULT_EXPLANATION = "Default explanation";
    static final List<String> DEFAULT_OPTIONS = List.of(
            "A) Default option A",
            "B) Default option B",
            "C) Default option C",
            "D) Default option D"
    );

    private static final Set<String> DIFFICULTIES = Set.of("beginner", "intermediate", "advanced");
    private static final String SLOTS = "ABCD";
    private static final Pattern LABEL_PREFIX = Pattern.compile("^[A-Da-d]\\s*[).:]\\s*");

    private final CodeSnippetSanitizer codeSnippetSanitizer;
    private final OptionRandomizer optionRandomizer;
    private final Random random;

    public QuestionPayloadNormalizer(CodeSnippetSanitizer codeSnippetSanitizer, OptionRandomizer optionRandomizer) {
        this(codeSnippetSanitizer, optionRandomizer, new Random());
    }

    public QuestionPayloadNormalizer(
            CodeSnippetSanitizer codeSnippetSanitizer,
            OptionRandomizer optionRandomizer,
            Random random) {
        this.codeSnippetSanitizer = codeSnippetSanitizer;
        this.optionRandomizer = optionRandomizer;
        this.random = random;
    }

    /**
     * @param raw      one element of the LLM's question array
     * @param position zero-based position in the batch, used for the placeholder text
     */
    public QuestionDraft normalize(JsonNode raw, int position) {
        String questionText = text(raw, "question", "question_text", "questionText");
        if (questionText.isBlank()) {
            questionText = PLACEHOLDER_PREFIX + " " + (position + 1);
        }

        LabeledOptions labeled = normalizeOptions(raw == null ? null : firstPresent(raw, "options"));
        List<String> options = labeled.options();

        String correctAnswer = labeled.relabel(text(raw, "correct_answer", "correctAnswer").toUpperCase(Locale.ROOT));
        boolean slotMissing = correctAnswer == null;
        if (slotMissing) {
            correctAnswer = String.valueOf(SLOTS.charAt(random.nextInt(Math.min(options.size(), SLOTS.length()))));
        }

        if (questionText.startsWith(PLACEHOLDER_PREFIX) || slotMissing) {
            OptionRandomizer.RandomizedOptions randomized = optionRandomizer.randomize(options, correctAnswer);
            options = randomized.options();
            correctAnswer = randomized.correctSlot();
        }

        String explanation = text(raw, "explanation");
        String questionType = text(raw, "question_type", "questionType").toLowerCase(Locale.ROOT);

        return new QuestionDraft(
                questionText,
                normalizeDifficulty(text(raw, "difficulty")),
                normalizePoints(raw == null ? null : firstPresent(raw, "points")),
                correctAnswer,
                options,
                explanation.isBlank() ? DEFAULT_EXPLANATION : explanation,
                questionType.isBlank() ? DEFAULT_QUESTION_TYPE : questionType,
                codeSnippetSanitizer.sanitize(text(raw, "code_snippet", "codeSnippet"))
        );
    }

    private LabeledOptions normalizeOptions(JsonNode node) {
        if (node == null || !node.isArray()) {
            return LabeledOptions.DEFAULTS;
        }
        List<String> payloads = new ArrayList<>();
        for (JsonNode element : node) {
            if (element == null || !element.isValueNode() || element.isNull()) {
                continue;
            }
            String value = element.asText().strip();
            if (!value.isBlank()) {
                payloads.add(value);
            }
            if (payloads.size() == SLOTS.length()) {
                break;
            }
        }
        if (payloads.size() < 2) {
            return LabeledOptions.DEFAULTS;
        }
        List<String> options = new ArrayList<>(payloads.size());
        List<Character> originalLabels = new ArrayList<>(payloads.size());
        for (int i = 0; i < payloads.size(); i++) {
            String option = payloads.get(i);
            Matcher prefix = LABEL_PREFIX.matcher(option);
            boolean hasLabel = prefix.lookingAt();
            originalLabels.add(hasLabel ? Character.toUpperCase(option.charAt(0)) : null);
            String payload = hasLabel ? option.substring(prefix.end()) : option;
            options.add(SLOTS.charAt(i) + ") " + payload);
        }
        return new LabeledOptions(List.copyOf(options), originalLabels);
    }

    /**
     * Options relabelled A, B, C... by position, plus the letter each option arrived with (null if unlabelled).
     */
    private record LabeledOptions(List<String> options, List<Character> originalLabels) {

        static final LabeledOptions DEFAULTS = new LabeledOptions(DEFAULT_OPTIONS, List.of('A', 'B', 'C', 'D'));

        /**
         * Maps the answer letter as the LLM wrote it onto the relabelled options. Returns null when no
         * option can be identified: the letter is malformed, names an option that is absent, or points
         * at a position whose option arrived with a different letter.
         */
        String relabel(String answerSlot) {
            if (answerSlot.length() != 1 || SLOTS.indexOf(answerSlot.charAt(0)) < 0) {
                return null;
            }
            char letter = answerSlot.charAt(0);
            int labeledAt = originalLabels.indexOf(letter);
            if (labeledAt >= 0) {
                return String.valueOf(SLOTS.charAt(labeledAt));
            }
            int position = SLOTS.indexOf(letter);
            if (position < options.size() && originalLabels.get(position) == null) {
                return answerSlot;
            }
            return null;
        }
    }

    private String normalizeDifficulty(String difficulty) {
        String value = difficulty.toLowerCase(Locale.ROOT);
        return DIFFICULTIES.contains(value) ? value : DEFAULT_DIFFICULTY;
    }

    private int normalizePoints(JsonNode node) {
        if (node == null || node.isNull()) {
            return DEFAULT_POINTS;
        }
        int points;
        if (node.isNumber()) {
            points = node.asInt();
        } else if (node.isTextual()) {
            try {
                points = Integer.parseInt(node.asText().strip());
            } catch (NumberFormatException e) {
                return DEFAULT_POINTS;
            }
        } else {
            return DEFAULT_POINTS;
        }
        return points > 0 ? points : DEFAULT_POINTS;
    }

    private JsonNode firstPresent(JsonNode raw, String... fields) {
        for (String field : fields) {
            JsonNode value = raw.get(field);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private String text(JsonNode raw, String... fields) {
        if (raw == null || !raw.isObject()) {
            return "";
        }
        JsonNode value = firstPresent(raw, fields);
        if (value == null || !value.isValueNode()) {
            return "";
        }
        return value.asText().strip();
    }
}
