package org.example.learnpath.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.learnpath.config.LearningProperties;
import org.example.learnpath.engine.QuestionPayloadNormalizer;
import org.example.learnpath.model.GenerationOutcome;
import org.example.learnpath.model.QuestionDraft;
import org.example.learnpath.service.llm.LlmGateway;
import org.example.learnpath.service.llm.LlmOptions;
import org.example.learnpath.service.llm.LlmProvider;
import org.example.learnpath.service.llm.LlmResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds question prompts from the learner's accuracy history, calls the question LLM and turns
 * the reply into validated drafts. Any failure degrades to a single deterministic question.
 */
@Service
public class AdaptiveQuestionGenerator {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveQuestionGenerator.class);
    private static final Pattern SURROUNDING_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*\\n?(.*?)\\n?```$", Pattern.DOTALL);
    private static final String SLOTS = "ABCD";
    static final String FALLBACK_MODEL = "local-fallback";

    private final LlmProvider questionProvider;
    private final LlmGateway llmGateway;
    private final QuestionPayloadNormalizer normalizer;
    private final ObjectMapper objectMapper;
    private final LearningProperties properties;
    private final Random random;

    @Autowired
    public AdaptiveQuestionGenerator(
            @Qualifier("questionLlmProvider") LlmProvider questionProvider,
            LlmGateway llmGateway,
            QuestionPayloadNormalizer normalizer,
            ObjectMapper objectMapper,
            LearningProperties properties) {
        this(questionProvider, llmGateway, normalizer, objectMapper, properties, new Random());
    }

    AdaptiveQuestionGenerator(
            LlmProvider questionProvider,
            LlmGateway llmGateway,
            QuestionPayloadNormalizer normalizer,
            ObjectMapper objectMapper,
            LearningProperties properties,
            Random random) {
        this.questionProvider = questionProvider;
        this.llmGateway = llmGateway;
        this.normalizer = normalizer;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.random = random;
    }

    public GenerationOutcome generate(AdaptiveQuestionRequest request) {
        DifficultyTier tier = DifficultyTier.forRecentAccuracy(request.recentAccuracy());
        String focus = progressFocus(request.totalAnswered());
        String prompt = String.format("""
            You are an expert educational content creator. Generate %d multiple-choice questions for day %d
            of a %d-day course on "%s".

            TODAY'S CONTENT:
            %s

            LEARNER PERFORMANCE:
            - Overall accuracy: %.1f%%
            - Recent accuracy (last %d answers): %.1f%%
            - Questions answered so far: %d

            ADAPTATION:
            - Make the questions %s than the learner's recent level.
            - Focus on %s.
            - Base points per question: %d.

            RULES:
            - Each question has exactly 4 options labeled "A) ", "B) ", "C) ", "D) ".
            - Exactly one correct answer; spread correct answers across A, B, C and D.
            - Include an explanation for the correct answer.
            - Put any code in "code_snippet" without markdown fences; use "" when there is no code.
            - Return valid JSON only, no markdown.

            JSON SCHEMA:
            {
              "questions": [
                {
                  "question": "string",
                  "difficulty": "beginner|intermediate|advanced",
                  "points": %d,
                  "correct_answer": "A",
                  "options": ["A) ...", "B) ...", "C) ...", "D) ..."],
                  "explanation": "string",
                  "question_type": "conceptual|practical|analytical",
                  "code_snippet": ""
                }
              ]
            }
            """,
                request.numQuestions(),
                request.dayNumber(),
                request.totalDays(),
                request.courseName(),
                contentOrDefault(request.dayContentBrief(), request.courseName(), request.dayNumber()),
                request.overallAccuracy(),
                properties.getGeneration().getRecentWindow(),
                request.recentAccuracy(),
                request.totalAnswered(),
                tier.adjustment(),
                focus,
                tier.basePoints(),
                tier.basePoints()
        );

        LlmOptions options = LlmOptions.bounded(
                properties.getGeneration().getAdaptiveTemperature(),
                properties.getGeneration().getAdaptiveMaxTokens());
        return run(prompt, options, request.courseName(), request.dayNumber(), request.numQuestions(),
                tier.basePoints(), "adaptive-questions");
    }

    public GenerationOutcome generateCustom(CustomQuestionRequest request) {
        AdaptiveQuestionRequest base = request.base();
        DifficultyPreference preference = DifficultyPreference.parse(request.difficultyPreference());
        String focus = request.focusAreas().isEmpty()
                ? "general understanding of the topic"
                : "specifically focus on: " + String.join(", ", request.focusAreas());
        String typeInstruction = request.questionTypes().isEmpty()
                ? "Include a mix of conceptual, practical, and analytical questions"
                : "Emphasize " + String.join(", ", request.questionTypes()) + " questions";
        String instructions = request.specialInstructions() == null || request.specialInstructions().isBlank()
                ? "None"
                : request.specialInstructions().strip();

        String prompt = String.format("""
            You are an expert educational content creator. The learner asked for a fresh set of questions.
            Generate %d multiple-choice questions for day %d of a %d-day course on "%s".

            TODAY'S CONTENT:
            %s

            LEARNER PERFORMANCE:
            - Overall accuracy: %.1f%%
            - Recent accuracy: %.1f%%
            - Questions answered so far: %d

            LEARNER PREFERENCES:
            - Difficulty: %s
            - Focus: %s
            - Question types: %s
            - Special instructions: %s
            - Base points per question: %d.

            RULES:
            - Each question has exactly 4 options labeled "A) ", "B) ", "C) ", "D) ".
            - Exactly one correct answer; spread correct answers across A, B, C and D.
            - Include an explanation for the correct answer.
            - Put any code in "code_snippet" without markdown fences; use "" when there is no code.
            - Return valid JSON only, no markdown.

            JSON SCHEMA:
            {
              "questions": [
                {
                  "question": "string",
                  "difficulty": "beginner|intermediate|advanced",
                  "points": %d,
                  "correct_answer": "A",
                  "options": ["A) ...", "B) ...", "C) ...", "D) ..."],
                  "explanation": "string",
                  "question_type": "conceptual|practical|analytical",
                  "code_snippet": ""
                }
              ]
            }
            """,
                base.numQuestions(),
                base.dayNumber(),
                base.totalDays(),
                base.courseName(),
                contentOrDefault(base.dayContentBrief(), base.courseName(), base.dayNumber()),
                base.overallAccuracy(),
                base.recentAccuracy(),
                base.totalAnswered(),
                preference.adjustment(),
                focus,
                typeInstruction,
                instructions,
                preference.basePoints(),
                preference.basePoints()
        );

        LlmOptions options = LlmOptions.bounded(
                properties.getGeneration().getCustomTemperature(),
                properties.getGeneration().getCustomMaxTokens());
        return run(prompt, options, base.courseName(), base.dayNumber(), base.numQuestions(),
                preference.basePoints(), "custom-questions");
    }

    private GenerationOutcome run(
            String prompt,
            LlmOptions options,
            String courseName,
            int dayNumber,
            int numQuestions,
            int basePoints,
            String purpose) {
        if (!properties.getGeneration().isEnabled()) {
            log.info("Question generation disabled; using fallback question for {} day {}", courseName, dayNumber);
            return fallback(courseName, basePoints, "generation disabled", 0L);
        }

        LlmResult result = llmGateway.call(questionProvider, prompt, options, purpose);
        if (!result.succeeded()) {
            log.warn("Question generation for {} day {} degraded to fallback: {}",
                    courseName, dayNumber, result.describeFailure());
            return fallback(courseName, basePoints, result.describeFailure(), result.durationMs());
        }

        List<QuestionDraft> drafts;
        try {
            drafts = parseDrafts(result.text(), numQuestions);
        } catch (IllegalArgumentException e) {
            log.warn("Unusable question payload for {} day {}; using fallback: {}",
                    courseName, dayNumber, e.getMessage());
            return fallback(courseName, basePoints, e.getMessage(), result.durationMs());
        }
        if (drafts.isEmpty()) {
            log.warn("Question payload for {} day {} contained no usable questions; using fallback", courseName, dayNumber);
            return fallback(courseName, basePoints, "no usable questions", result.durationMs());
        }

        log.info("Generated {} questions for {} day {} via {} in {} ms",
                drafts.size(), courseName, dayNumber, result.providerName(), result.durationMs());
        return new GenerationOutcome(drafts, false, modelName(), null, result.durationMs());
    }

    List<QuestionDraft> parseDrafts(String generated, int numQuestions) {
        JsonNode root;
        try {
            root = objectMapper.readTree(stripFence(generated));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON question response from LLM provider", e);
        }
        JsonNode items = root;
        if (root != null && root.isObject()) {
            items = root.get("questions");
        }
        if (items == null || !items.isArray()) {
            throw new IllegalArgumentException("No question array found in LLM response");
        }

        List<QuestionDraft> drafts = new ArrayList<>();
        for (JsonNode item : items) {
            if (drafts.size() >= numQuestions) {
                break;
            }
            if (item == null || !item.isObject()) {
                continue;
            }
            drafts.add(normalizer.normalize(item, drafts.size()));
        }
        return drafts;
    }

    GenerationOutcome fallback(String courseName, int basePoints, String reason, long durationMs) {
        int correctIndex = random.nextInt(SLOTS.length());
        List<String> options = new ArrayList<>(SLOTS.length());
        for (int i = 0; i < SLOTS.length(); i++) {
            String text = i == correctIndex ? "Key concept from " + courseName : "Wrong option " + (i + 1);
            options.add(SLOTS.charAt(i) + ") " + text);
        }
        QuestionDraft question = new QuestionDraft(
                "What is a key concept from today's lesson on " + courseName + "?",
                "intermediate",
                basePoints,
                String.valueOf(SLOTS.charAt(correctIndex)),
                options,
                "This tests understanding of the main concept from " + courseName + ".",
                "conceptual",
                ""
        );
        return new GenerationOutcome(List.of(question), true, FALLBACK_MODEL, reason, durationMs);
    }

    static String stripFence(String text) {
        String trimmed = text == null ? "" : text.strip();
        Matcher matcher = SURROUNDING_FENCE.matcher(trimmed);
        if (matcher.matches()) {
            return matcher.group(1).strip();
        }
        return trimmed;
    }

    private String modelName() {
        return questionProvider.getProviderName() + ":" + questionProvider.getModelName();
    }

    private String contentOrDefault(String brief, String courseName, int dayNumber) {
        if (brief == null || brief.isBlank()) {
            return StudyPlanBootstrapper.fallbackBrief(courseName, dayNumber);
        }
        return brief;
    }

    static String progressFocus(int totalAnswered) {
        if (totalAnswered < 5) {
            return "fundamental concepts with clear explanations";
        }
        if (totalAnswered < 15) {
            return "practical applications and examples";
        }
        return "advanced problem-solving and critical thinking";
    }

    public enum DifficultyTier {
        HARDER("slightly harder", 20),
        BALANCED("balanced", 15),
        EASIER("slightly easier with more explanation", 10);

        private final String adjustment;
        private final int basePoints;

        DifficultyTier(String adjustment, int basePoints) {
            this.adjustment = adjustment;
            this.basePoints = basePoints;
        }

        public static DifficultyTier forRecentAccuracy(double recentAccuracy) {
            if (recentAccuracy >= 80) {
                return HARDER;
            }
            if (recentAccuracy >= 60) {
                return BALANCED;
            }
            return EASIER;
        }

        public String adjustment() {
            return adjustment;
        }

        public int basePoints() {
            return basePoints;
        }
    }

    public enum DifficultyPreference {
        EASIER("easier with more detailed explanations", 8),
        BALANCED("balanced difficulty", 15),
        HARDER("more challenging with complex scenarios", 25);

        private final String adjustment;
        private final int basePoints;

        DifficultyPreference(String adjustment, int basePoints) {
            this.adjustment = adjustment;
            this.basePoints = basePoints;
        }

        public static DifficultyPreference parse(String value) {
            if (value == null) {
                return BALANCED;
            }
            return switch (value.strip().toLowerCase(Locale.ROOT)) {
                case "easier" -> EASIER;
                case "harder" -> HARDER;
                default -> BALANCED;
            };
        }

        public String adjustment() {
            return adjustment;
        }

        public int basePoints() {
            return basePoints;
        }
    }

    public record AdaptiveQuestionRequest(
            String courseName,
            int dayNumber,
            int totalDays,
            String dayContentBrief,
            double overallAccuracy,
            double recentAccuracy,
            int totalAnswered,
            int numQuestions
    ) {
    }

    public record CustomQuestionRequest(
            AdaptiveQuestionRequest base,
            List<String> focusAreas,
            String difficultyPreference,
            List<String> questionTypes,
            String specialInstructions
    ) {
        public CustomQuestionRequest {
            focusAreas = focusAreas == null ? List.of() : List.copyOf(focusAreas);
            questionTypes = questionTypes == null ? List.of() : List.copyOf(questionTypes);
        }
    }
}
