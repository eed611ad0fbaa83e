package org.example.learnpath.controller;

import org.example.learnpath.config.LearningProperties;
import org.example.learnpath.model.AnswerResult;
import org.example.learnpath.model.CourseSummary;
import org.example.learnpath.model.DayStatus;
import org.example.learnpath.model.LearnerProfile;
import org.example.learnpath.model.ProgressSummary;
import org.example.learnpath.model.QuestionEvaluation;
import org.example.learnpath.model.QuestionEvaluationRequest;
import org.example.learnpath.model.QuestionView;
import org.example.learnpath.model.RegenerationPreferences;
import org.example.learnpath.service.AnswerSubmissionService;
import org.example.learnpath.service.CourseService;
import org.example.learnpath.service.DayProgressionService;
import org.example.learnpath.service.LearnerService;
import org.example.learnpath.service.LearningMetricsService;
import org.example.learnpath.service.ProgressQueryService;
import org.example.learnpath.service.QuestionQualityEvaluator;
import org.example.learnpath.service.exception.AttemptLimitExceededException;
import org.example.learnpath.service.exception.DayAccessDeniedException;
import org.example.learnpath.service.exception.DuplicateResourceException;
import org.example.learnpath.service.exception.QuestionEvaluationException;
import org.example.learnpath.service.exception.ResourceNotFoundException;
import org.example.learnpath.service.llm.LlmProvider;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(LearningController.class)
@Import(LearningProperties.class)
@TestPropertySource(properties = {
        "learning.answers.max-attempts=3",
        "learning.generation.default-question-count=8"
})
class LearningControllerTest {

    private static final String DAY_PATH = "/api/learning/learners/learner-1/courses/course-1/days/";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private LearnerService learnerService;

    @MockitoBean
    private CourseService courseService;

    @MockitoBean
    private DayProgressionService dayProgressionService;

    @MockitoBean
    private AnswerSubmissionService answerSubmissionService;

    @MockitoBean
    private ProgressQueryService progressQueryService;

    @MockitoBean
    private QuestionQualityEvaluator questionQualityEvaluator;

    @MockitoBean
    private LearningMetricsService metricsService;

    @MockitoBean(name = "questionLlmProvider")
    private LlmProvider questionProvider;

    @Test
    void getStatus_reportsConfigurationAndMetrics() throws Exception {
        when(questionProvider.getProviderName()).thenReturn("ollama");
        when(questionProvider.isAvailable()).thenReturn(true);
        when(metricsService.snapshot()).thenReturn(Map.of("generationRequested", 4L, "answersSubmitted", 9L));

        mockMvc.perform(get("/api/learning/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.generationEnabled", is(true)))
                .andExpect(jsonPath("$.questionProvider", is("ollama")))
                .andExpect(jsonPath("$.providerAvailable", is(true)))
                .andExpect(jsonPath("$.defaultQuestionCount", is(8)))
                .andExpect(jsonPath("$.maxAttempts", is(3)))
                .andExpect(jsonPath("$.metrics.answersSubmitted", is(9)));
    }

    @Test
    void registerLearner_returnsCreated() throws Exception {
        when(learnerService.registerLearner("Ada", "ada"))
                .thenReturn(new LearnerProfile("learner-1", "Ada", "ada", LocalDateTime.of(2026, 1, 5, 8, 0)));

        mockMvc.perform(post("/api/learning/learners")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"displayName\":\"Ada\",\"handle\":\"ada\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id", is("learner-1")))
                .andExpect(jsonPath("$.handle", is("ada")));
    }

    @Test
    void registerLearner_duplicateHandle_returnsConflict() throws Exception {
        when(learnerService.registerLearner("Ada", "ada"))
                .thenThrow(new DuplicateResourceException("Handle already exists: ada"));

        mockMvc.perform(post("/api/learning/learners")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"displayName\":\"Ada\",\"handle\":\"ada\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason", is("DUPLICATE")));
    }

    @Test
    void createCourse_returnsCreatedSummary() throws Exception {
        when(courseService.createCourse("learner-1", "JavaScript", null, 7, true))
                .thenReturn(new CourseSummary("course-1", "learner-1", "JavaScript", null, 7, true, false,
                        LocalDateTime.of(2026, 1, 5, 8, 0)));

        mockMvc.perform(post("/api/learning/courses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"learnerId\":\"learner-1\",\"name\":\"JavaScript\",\"durationDays\":7,\"custom\":true}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id", is("course-1")))
                .andExpect(jsonPath("$.durationDays", is(7)))
                .andExpect(jsonPath("$.planFallbackUsed", is(false)));
    }

    @Test
    void createCourse_missingDuration_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/learning/courses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"learnerId\":\"learner-1\",\"name\":\"JavaScript\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(courseService);
    }

    @Test
    void getDayStatus_returnsFlags() throws Exception {
        when(dayProgressionService.computeDayStatus("learner-1", "course-1", 2))
                .thenReturn(new DayStatus(2, true, false, true, 4, 1, 25.0, true, true, true, false, true));

        mockMvc.perform(get(DAY_PATH + "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dayNumber", is(2)))
                .andExpect(jsonPath("$.unlocked", is(true)))
                .andExpect(jsonPath("$.completionPercentage", is(25.0)))
                .andExpect(jsonPath("$.canContinue", is(true)));
    }

    @Test
    void getDayStatus_dayOutOfRange_returnsBadRequest() throws Exception {
        when(dayProgressionService.computeDayStatus("learner-1", "course-1", 9))
                .thenThrow(new IllegalArgumentException("Day number must be between 1 and 7 but was 9"));

        mockMvc.perform(get(DAY_PATH + "9"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", is("Day number must be between 1 and 7 but was 9")));
    }

    @Test
    void getDayStatus_nonNumericDay_returnsBadRequest() throws Exception {
        mockMvc.perform(get(DAY_PATH + "two"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void generateQuestions_lockedDay_returnsForbiddenWithReason() throws Exception {
        when(dayProgressionService.generateQuestionsForDay("learner-1", "course-1", 3, null))
                .thenThrow(new DayAccessDeniedException(DayAccessDeniedException.Reason.DAY_LOCKED, 3));

        mockMvc.perform(post(DAY_PATH + "3/questions"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.status", is(403)))
                .andExpect(jsonPath("$.reason", is("DAY_LOCKED")))
                .andExpect(jsonPath("$.message", is("Day 3 is locked. Complete the previous day first.")));
    }

    @Test
    void generateQuestions_withCount_returnsQuestionsWithoutAnswers() throws Exception {
        when(dayProgressionService.generateQuestionsForDay("learner-1", "course-1", 1, 5))
                .thenReturn(List.of(new QuestionView("q-1", 1, "Pick one", "beginner", 10,
                        List.of("A) yes", "B) no"), "conceptual", "", false)));

        mockMvc.perform(post(DAY_PATH + "1/questions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"count\":5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id", is("q-1")))
                .andExpect(jsonPath("$[0].options", hasSize(2)))
                .andExpect(jsonPath("$[0].correctAnswer").doesNotExist());
    }

    @Test
    void regenerateQuestions_passesPreferences() throws Exception {
        when(dayProgressionService.regenerateQuestionsForDay(eq("learner-1"), eq("course-1"), eq(1),
                any(RegenerationPreferences.class)))
                .thenReturn(List.of());

        mockMvc.perform(post(DAY_PATH + "1/regenerate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"focusAreas\":[\"closures\"],\"difficultyPreference\":\"harder\",\"numQuestions\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));

        ArgumentCaptor<RegenerationPreferences> captor = ArgumentCaptor.forClass(RegenerationPreferences.class);
        verify(dayProgressionService).regenerateQuestionsForDay(eq("learner-1"), eq("course-1"), eq(1), captor.capture());
        assertEquals(List.of("closures"), captor.getValue().focusAreas());
        assertEquals("harder", captor.getValue().difficultyPreference());
        assertEquals(3, captor.getValue().numQuestions());
    }

    @Test
    void regenerateQuestions_completedDay_returnsForbidden() throws Exception {
        when(dayProgressionService.regenerateQuestionsForDay(eq("learner-1"), eq("course-1"), eq(1), isNull()))
                .thenThrow(new DayAccessDeniedException(DayAccessDeniedException.Reason.DAY_ALREADY_COMPLETED, 1));

        mockMvc.perform(post(DAY_PATH + "1/regenerate"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.reason", is("DAY_ALREADY_COMPLETED")));
    }

    @Test
    void getDayReview_unknownCourse_returnsNotFound() throws Exception {
        when(dayProgressionService.getDayReview("learner-1", "course-1", 1))
                .thenThrow(new ResourceNotFoundException("Course", "course-1"));

        mockMvc.perform(get(DAY_PATH + "1/review"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message", is("Course not found: course-1")));
    }

    @Test
    void submitAnswer_returnsGrade() throws Exception {
        when(answerSubmissionService.submitAnswer("learner-1", "q-1", "b"))
                .thenReturn(new AnswerResult("q-1", true, 15, "B", "const is fixed.", "Correct! Well done!", 1));

        mockMvc.perform(post("/api/learning/learners/learner-1/answers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questionId\":\"q-1\",\"answer\":\"b\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.correct", is(true)))
                .andExpect(jsonPath("$.earnedPoints", is(15)))
                .andExpect(jsonPath("$.feedback", is("Correct! Well done!")));
    }

    @Test
    void submitAnswer_attemptLimit_returnsConflict() throws Exception {
        when(answerSubmissionService.submitAnswer("learner-1", "q-1", "C"))
                .thenThrow(new AttemptLimitExceededException("q-1", 3));

        mockMvc.perform(post("/api/learning/learners/learner-1/answers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questionId\":\"q-1\",\"answer\":\"C\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason", is("ATTEMPT_LIMIT_EXCEEDED")));
    }

    @Test
    void submitAnswer_malformedBody_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/learning/learners/learner-1/answers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void getCourseProgress_returnsSummary() throws Exception {
        when(progressQueryService.getCourseProgress("learner-1", "course-1"))
                .thenReturn(new ProgressSummary("course-1", 7, 10, 5, 60, 120, 50.0, 2, 1));

        mockMvc.perform(get("/api/learning/learners/learner-1/courses/course-1/progress"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentDay", is(2)))
                .andExpect(jsonPath("$.earnedPoints", is(60)))
                .andExpect(jsonPath("$.completedDays", is(1)));
    }

    @Test
    void regenerateQuestions_dayWithoutQuestions_returnsForbidden() throws Exception {
        when(dayProgressionService.regenerateQuestionsForDay(eq("learner-1"), eq("course-1"), eq(1), any()))
                .thenThrow(new DayAccessDeniedException(DayAccessDeniedException.Reason.NO_QUESTIONS_YET, 1));

        mockMvc.perform(post(DAY_PATH + "1/regenerate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.reason", is("NO_QUESTIONS_YET")));
    }

    @Test
    void evaluateQuestion_returnsScoreAndFeedback() throws Exception {
        when(questionQualityEvaluator.evaluate(any())).thenReturn(new QuestionEvaluation(
                82, "B",
                Map.of("clarity", Map.of("score", 90, "comments", "Clear wording.")),
                List.of("Make distractor C more plausible."),
                List.of("Accurate explanation"),
                List.of("Distractors")));

        mockMvc.perform(post("/api/learning/questions/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"courseName": "Python", "dayNumber": 2, "question": "What does len([]) return?",
                                 "options": ["A) 0", "B) 1", "C) None", "D) error"], "correctAnswer": "A"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overallScore", is(82)))
                .andExpect(jsonPath("$.grade", is("B")))
                .andExpect(jsonPath("$.detailedFeedback.clarity.score", is(90)))
                .andExpect(jsonPath("$.recommendations", hasSize(1)));

        ArgumentCaptor<QuestionEvaluationRequest> captor = ArgumentCaptor.forClass(QuestionEvaluationRequest.class);
        verify(questionQualityEvaluator).evaluate(captor.capture());
        assertEquals("Python", captor.getValue().courseName());
        assertEquals(2, captor.getValue().dayNumber());
        assertEquals("beginner", captor.getValue().difficulty());
        assertEquals(4, captor.getValue().options().size());
    }

    @Test
    void evaluateQuestion_llmFailure_returnsServerErrorWithReason() throws Exception {
        when(questionQualityEvaluator.evaluate(any()))
                .thenThrow(new QuestionEvaluationException("TIMEOUT: no response within 90000 ms"));

        mockMvc.perform(post("/api/learning/questions/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\": \"Q\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.reason", is("EVALUATION_FAILED")))
                .andExpect(jsonPath("$.message", is("Failed to evaluate question. Please try again.")));
    }
}
