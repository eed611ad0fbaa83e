package org.example.learnpath.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.learnpath.config.LearningProperties;
import org.example.learnpath.engine.CodeSnippetSanitizer;
import org.example.learnpath.model.QuestionEvaluation;
import org.example.learnpath.model.QuestionEvaluationRequest;
import org.example.learnpath.service.exception.QuestionEvaluationException;
import org.example.learnpath.service.llm.LlmGateway;
import org.example.learnpath.service.llm.LlmOptions;
import org.example.learnpath.service.llm.LlmProvider;
import org.example.learnpath.service.llm.LlmResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Asks the question LLM to grade a generated question on clarity, correctness and teaching value.
 * Unlike question generation there is no fallback: a failed review surfaces as
 * {@link QuestionEvaluationException}.
 */
@Service
public class QuestionQualityEvaluator {

    private static final Logger log = LoggerFactory.getLogger(QuestionQualityEvaluator.class);
    static final String SYSTEM_LEARNER = "system";

    private final LlmProvider questionProvider;
    private final LlmGateway llmGateway;
    private final CodeSnippetSanitizer codeSnippetSanitizer;
    private final ObjectMapper objectMapper;
    private final ActivityRecorder activityRecorder;
    private final LearningProperties properties;

    public QuestionQualityEvaluator(
            @Qualifier("questionLlmProvider") LlmProvider questionProvider,
            LlmGateway llmGateway,
            CodeSnippetSanitizer codeSnippetSanitizer,
            ObjectMapper objectMapper,
            ActivityRecorder activityRecorder,
            LearningProperties properties) {
        this.questionProvider = questionProvider;
        this.llmGateway = llmGateway;
        this.codeSnippetSanitizer = codeSnippetSanitizer;
        this.objectMapper = objectMapper;
        this.activityRecorder = activityRecorder;
        this.properties = properties;
    }

    public QuestionEvaluation evaluate(QuestionEvaluationRequest request) {
        if (request == null || request.question() == null || request.question().isBlank()) {
            throw new IllegalArgumentException("question is required");
        }
        String codeSnippet = codeSnippetSanitizer.sanitize(request.codeSnippet());

        LlmOptions options = LlmOptions.bounded(
                properties.getEvaluation().getTemperature(),
                properties.getEvaluation().getMaxTokens());
        LlmResult result = llmGateway.call(questionProvider, buildPrompt(request, codeSnippet), options,
                "question-evaluation");
        if (!result.succeeded()) {
            throw failed(request, result.describeFailure(), null);
        }

        QuestionEvaluation evaluation;
        try {
            evaluation = parseEvaluation(result.text());
        } catch (IllegalArgumentException e) {
            throw failed(request, e.getMessage(), e);
        }
        log.info("Question evaluated for {} day {}: score {} ({}) in {} ms",
                request.courseName(), request.dayNumber(), evaluation.overallScore(), evaluation.grade(),
                result.durationMs());
        return evaluation;
    }

    QuestionEvaluation parseEvaluation(String generated) {
        JsonNode root;
        try {
            root = objectMapper.readTree(AdaptiveQuestionGenerator.stripFence(generated));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON evaluation response from LLM provider", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Evaluation response is not a JSON object");
        }

        JsonNode scoreNode = field(root, "overall_score", "overallScore");
        if (scoreNode == null || !(scoreNode.isNumber() || scoreNode.isTextual())) {
            throw new IllegalArgumentException("Evaluation response has no overall_score");
        }
        int score;
        try {
            score = scoreNode.isNumber() ? scoreNode.asInt() : (int) Math.round(Double.parseDouble(scoreNode.asText().strip()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("overall_score is not a number: " + scoreNode.asText(), e);
        }
        score = Math.max(0, Math.min(100, score));

        JsonNode gradeNode = field(root, "grade");
        String grade = gradeNode != null && gradeNode.isValueNode() && !gradeNode.asText().isBlank()
                ? gradeNode.asText().strip()
                : letterGrade(score);

        return new QuestionEvaluation(
                score,
                grade,
                detailedFeedback(field(root, "detailed_feedback", "detailedFeedback")),
                textList(field(root, "recommendations")),
                textList(field(root, "strengths")),
                textList(field(root, "areas_for_improvement", "areasForImprovement"))
        );
    }

    static String letterGrade(int score) {
        if (score >= 90) {
            return "A";
        }
        if (score >= 80) {
            return "B";
        }
        if (score >= 70) {
            return "C";
        }
        if (score >= 60) {
            return "D";
        }
        return "F";
    }

    private QuestionEvaluationException failed(QuestionEvaluationRequest request, String detail, Throwable cause) {
        log.error("Failed to evaluate question for {} day {}: {}", request.courseName(), request.dayNumber(), detail);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("courseName", request.courseName());
        details.put("dayNumber", request.dayNumber());
        details.put("error", detail);
        activityRecorder.record(SYSTEM_LEARNER, "question_evaluation_failed", details);
        return new QuestionEvaluationException(detail, cause);
    }

    private String buildPrompt(QuestionEvaluationRequest request, String codeSnippet) {
        return String.format("""
            You are a senior programming instructor reviewing a multiple-choice question written for
            day %d of a course on "%s".

            QUESTION TYPE: %s
            TARGET DIFFICULTY: %s

            QUESTION:
            %s

            CODE SNIPPET:
            %s

            OPTIONS:
            %s

            MARKED CORRECT ANSWER: %s
            EXPLANATION: %s

            Score the question from 0 to 100. Judge technical accuracy, whether exactly one option is
            correct, clarity of wording, fit to the target difficulty, plausibility of the distractors
            and the quality of the explanation.

            Return valid JSON only, no markdown:
            {
              "overall_score": 0,
              "grade": "A|B|C|D|F",
              "detailed_feedback": {
                "technical_accuracy": {"score": 0, "comments": "string"},
                "clarity": {"score": 0, "comments": "string"},
                "difficulty_fit": {"score": 0, "comments": "string"},
                "distractors": {"score": 0, "comments": "string"},
                "explanation": {"score": 0, "comments": "string"}
              },
              "recommendations": ["string"],
              "strengths": ["string"],
              "areas_for_improvement": ["string"]
            }
            """,
                request.dayNumber(),
                request.courseName(),
                request.questionType(),
                request.difficulty(),
                request.question().strip(),
                codeSnippet.isEmpty() ? "(none)" : codeSnippet,
                request.options().isEmpty() ? "(none)" : String.join("\n", request.options()),
                request.correctAnswer(),
                request.explanation()
        );
    }

    private Map<String, Map<String, Object>> detailedFeedback(JsonNode node) {
        Map<String, Map<String, Object>> feedback = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return feedback;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!entry.getValue().isObject()) {
                continue;
            }
            Map<String, Object> criterion = new LinkedHashMap<>();
            entry.getValue().fields().forEachRemaining(item ->
                    criterion.put(item.getKey(), objectMapper.convertValue(item.getValue(), Object.class)));
            feedback.put(entry.getKey(), criterion);
        }
        return feedback;
    }

    private List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return values;
        }
        for (JsonNode element : node) {
            if (element.isValueNode() && !element.isNull() && !element.asText().isBlank()) {
                values.add(element.asText().strip());
            }
        }
        return values;
    }

    private JsonNode field(JsonNode root, String... names) {
        for (String name : names) {
            JsonNode value = root.get(name);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }
}
