package org.example.learnpath.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.learnpath.config.LearningProperties;
import org.example.learnpath.model.PlanDay;
import org.example.learnpath.model.PlanOutline;
import org.example.learnpath.service.llm.LlmGateway;
import org.example.learnpath.service.llm.LlmOptions;
import org.example.learnpath.service.llm.LlmProvider;
import org.example.learnpath.service.llm.LlmResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Produces the day-by-day outline for a new course. Every day in range gets a brief, taken from the
 * LLM outline when it provides one and from a fixed template otherwise.
 */
@Service
public class StudyPlanBootstrapper {

    private static final Logger log = LoggerFactory.getLogger(StudyPlanBootstrapper.class);

    private final LlmProvider planProvider;
    private final LlmGateway llmGateway;
    private final ObjectMapper objectMapper;
    private final LearningProperties properties;

    public StudyPlanBootstrapper(
            @Qualifier("planLlmProvider") LlmProvider planProvider,
            LlmGateway llmGateway,
            ObjectMapper objectMapper,
            LearningProperties properties) {
        this.planProvider = planProvider;
        this.llmGateway = llmGateway;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public PlanOutline bootstrap(String courseName, int durationDays) {
        if (durationDays < 1) {
            throw new IllegalArgumentException("durationDays must be positive");
        }
        Map<Integer, String> briefs = Map.of();
        String modelName = AdaptiveQuestionGenerator.FALLBACK_MODEL;

        if (properties.getGeneration().isEnabled()) {
            LlmResult result = llmGateway.call(planProvider, buildPrompt(courseName, durationDays),
                    LlmOptions.bounded(properties.getPlan().getTemperature(), properties.getPlan().getMaxTokens()),
                    "study-plan");
            if (result.succeeded()) {
                try {
                    briefs = parseBriefs(result.text(), durationDays);
                    modelName = planProvider.getProviderName() + ":" + planProvider.getModelName();
                } catch (IllegalArgumentException e) {
                    log.warn("Unusable study plan payload for {}; using fallback briefs: {}", courseName, e.getMessage());
                }
            } else {
                log.warn("Study plan generation for {} degraded to fallback: {}", courseName, result.describeFailure());
            }
        }

        List<PlanDay> days = new ArrayList<>(durationDays);
        int fallbackDays = 0;
        for (int day = 1; day <= durationDays; day++) {
            String brief = briefs.get(day);
            if (brief == null) {
                brief = fallbackBrief(courseName, day);
                fallbackDays++;
            }
            days.add(new PlanDay(day, brief));
        }
        if (fallbackDays > 0 && fallbackDays < durationDays) {
            log.warn("Study plan for {} was missing {} of {} days; filled with fallback briefs",
                    courseName, fallbackDays, durationDays);
        }
        return new PlanOutline(days, fallbackDays, modelName);
    }

    public static String fallbackBrief(String courseName, int dayNumber) {
        return "Day " + dayNumber + ": Study " + courseName + " fundamentals and core concepts";
    }

    Map<Integer, String> parseBriefs(String generated, int durationDays) {
        String content = generated == null ? "" : generated.strip();
        if (content.startsWith("```json")) {
            content = content.substring(7);
        } else if (content.startsWith("```")) {
            content = content.substring(3);
        }
        if (content.endsWith("```")) {
            content = content.substring(0, content.length() - 3);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(content.strip());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON study plan response from LLM provider", e);
        }
        JsonNode daysNode = root == null ? null : root.get("days");
        if (daysNode == null || !daysNode.isArray()) {
            throw new IllegalArgumentException("No days array found in study plan response");
        }

        Map<Integer, String> briefs = new LinkedHashMap<>();
        for (JsonNode dayNode : daysNode) {
            if (dayNode == null || !dayNode.isObject()) {
                continue;
            }
            JsonNode dayField = dayNode.get("day");
            if (dayField == null || !dayField.canConvertToInt()) {
                continue;
            }
            int day = dayField.asInt();
            if (day < 1 || day > durationDays || briefs.containsKey(day)) {
                continue;
            }
            String brief = formatBrief(dayNode);
            if (brief != null) {
                briefs.put(day, brief);
            }
        }
        return briefs;
    }

    private String formatBrief(JsonNode dayNode) {
        List<String> objectives = new ArrayList<>();
        JsonNode objectivesNode = dayNode.get("objectives");
        if (objectivesNode != null && objectivesNode.isArray()) {
            for (JsonNode objective : objectivesNode) {
                if (objective.isValueNode() && !objective.asText().isBlank()) {
                    objectives.add(objective.asText().strip());
                }
            }
        }
        JsonNode contentNode = dayNode.get("content");
        String content = contentNode == null || !contentNode.isValueNode() ? "" : contentNode.asText().strip();
        if (objectives.isEmpty() && content.isBlank()) {
            return null;
        }
        return "Objectives: " + String.join(", ", objectives) + "\n\nContent: " + content;
    }

    private String buildPrompt(String courseName, int durationDays) {
        return String.format("""
            Create a %d-day study plan for the course "%s".

            RULES:
            - One entry per day, numbered 1 to %d, building from fundamentals to advanced topics.
            - Each day lists 2-4 learning objectives and a short content summary.
            - Return valid JSON only, no markdown.

            JSON SCHEMA:
            {
              "days": [
                {
                  "day": 1,
                  "objectives": ["string", "string"],
                  "content": "string"
                }
              ]
            }
            """, durationDays, courseName, durationDays);
    }
}
