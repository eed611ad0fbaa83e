package org.example.learnpath.controller;

import org.example.learnpath.config.LearningProperties;
import org.example.learnpath.model.AnswerResult;
import org.example.learnpath.model.CourseOverview;
import org.example.learnpath.model.CourseSummary;
import org.example.learnpath.model.DayStatus;
import org.example.learnpath.model.LearnerProfile;
import org.example.learnpath.model.PlanDay;
import org.example.learnpath.model.ProgressSummary;
import org.example.learnpath.model.QuestionEvaluation;
import org.example.learnpath.model.QuestionEvaluationRequest;
import org.example.learnpath.model.QuestionReview;
import org.example.learnpath.model.QuestionView;
import org.example.learnpath.model.RegenerationPreferences;
import org.example.learnpath.service.AnswerSubmissionService;
import org.example.learnpath.service.CourseService;
import org.example.learnpath.service.DayProgressionService;
import org.example.learnpath.service.LearnerService;
import org.example.learnpath.service.LearningMetricsService;
import org.example.learnpath.service.ProgressQueryService;
import org.example.learnpath.service.QuestionQualityEvaluator;
import org.example.learnpath.service.llm.LlmProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/learning")
public class LearningController {

    private final LearnerService learnerService;
    private final CourseService courseService;
    private final DayProgressionService dayProgressionService;
    private final AnswerSubmissionService answerSubmissionService;
    private final ProgressQueryService progressQueryService;
    private final QuestionQualityEvaluator questionQualityEvaluator;
    private final LearningMetricsService metricsService;
    private final LearningProperties properties;
    private final LlmProvider questionProvider;

    public LearningController(
            LearnerService learnerService,
            CourseService courseService,
            DayProgressionService dayProgressionService,
            AnswerSubmissionService answerSubmissionService,
            ProgressQueryService progressQueryService,
            QuestionQualityEvaluator questionQualityEvaluator,
            LearningMetricsService metricsService,
            LearningProperties properties,
            @Qualifier("questionLlmProvider") LlmProvider questionProvider) {
        this.learnerService = learnerService;
        this.courseService = courseService;
        this.dayProgressionService = dayProgressionService;
        this.answerSubmissionService = answerSubmissionService;
        this.progressQueryService = progressQueryService;
        this.questionQualityEvaluator = questionQualityEvaluator;
        this.metricsService = metricsService;
        this.properties = properties;
        this.questionProvider = questionProvider;
    }

    @GetMapping("/status")
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("generationEnabled", properties.getGeneration().isEnabled());
        status.put("questionProvider", questionProvider.getProviderName());
        status.put("providerAvailable", questionProvider.isAvailable());
        status.put("defaultQuestionCount", properties.getGeneration().getDefaultQuestionCount());
        status.put("maxAttempts", properties.getAnswers().getMaxAttempts());
        status.put("metrics", metricsService.snapshot());
        return status;
    }

    @PostMapping("/learners")
    public ResponseEntity<LearnerProfile> registerLearner(@RequestBody RegisterLearnerRequest request) {
        if (request == null) {
            return ResponseEntity.badRequest().build();
        }
        LearnerProfile profile = learnerService.registerLearner(request.displayName(), request.handle());
        return ResponseEntity.status(HttpStatus.CREATED).body(profile);
    }

    @GetMapping("/learners/{learnerId}")
    public LearnerProfile getLearner(@PathVariable String learnerId) {
        return learnerService.getLearner(learnerId);
    }

    @PostMapping("/courses")
    public ResponseEntity<CourseSummary> createCourse(@RequestBody CreateCourseRequest request) {
        if (request == null || request.durationDays() == null) {
            return ResponseEntity.badRequest().build();
        }
        CourseSummary course = courseService.createCourse(
                request.learnerId(),
                request.name(),
                request.description(),
                request.durationDays(),
                Boolean.TRUE.equals(request.custom())
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(course);
    }

    @GetMapping("/learners/{learnerId}/courses")
    public List<CourseSummary> listCourses(@PathVariable String learnerId) {
        return courseService.listCourses(learnerId);
    }

    @GetMapping("/learners/{learnerId}/courses/{courseId}/plan")
    public List<PlanDay> getPlan(@PathVariable String learnerId, @PathVariable String courseId) {
        return courseService.getPlan(learnerId, courseId);
    }

    @GetMapping("/learners/{learnerId}/courses/{courseId}/days")
    public List<DayStatus> getDayStatuses(@PathVariable String learnerId, @PathVariable String courseId) {
        return dayProgressionService.getCourseDayStatuses(learnerId, courseId);
    }

    @GetMapping("/learners/{learnerId}/courses/{courseId}/days/{day}")
    public DayStatus getDayStatus(
            @PathVariable String learnerId,
            @PathVariable String courseId,
            @PathVariable int day) {
        return dayProgressionService.computeDayStatus(learnerId, courseId, day);
    }

    @PostMapping("/learners/{learnerId}/courses/{courseId}/days/{day}/questions")
    public List<QuestionView> generateQuestions(
            @PathVariable String learnerId,
            @PathVariable String courseId,
            @PathVariable int day,
            @RequestBody(required = false) GenerateQuestionsRequest request) {
        Integer count = request == null ? null : request.count();
        return dayProgressionService.generateQuestionsForDay(learnerId, courseId, day, count);
    }

    @PostMapping("/learners/{learnerId}/courses/{courseId}/days/{day}/regenerate")
    public List<QuestionView> regenerateQuestions(
            @PathVariable String learnerId,
            @PathVariable String courseId,
            @PathVariable int day,
            @RequestBody(required = false) RegenerationPreferences preferences) {
        return dayProgressionService.regenerateQuestionsForDay(learnerId, courseId, day, preferences);
    }

    @GetMapping("/learners/{learnerId}/courses/{courseId}/days/{day}/review")
    public List<QuestionReview> getDayReview(
            @PathVariable String learnerId,
            @PathVariable String courseId,
            @PathVariable int day) {
        return dayProgressionService.getDayReview(learnerId, courseId, day);
    }

    @PostMapping("/learners/{learnerId}/answers")
    public ResponseEntity<AnswerResult> submitAnswer(
            @PathVariable String learnerId,
            @RequestBody SubmitAnswerRequest request) {
        if (request == null || request.questionId() == null) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(answerSubmissionService.submitAnswer(learnerId, request.questionId(), request.answer()));
    }

    @GetMapping("/learners/{learnerId}/courses/{courseId}/progress")
    public ProgressSummary getCourseProgress(@PathVariable String learnerId, @PathVariable String courseId) {
        return progressQueryService.getCourseProgress(learnerId, courseId);
    }

    @GetMapping("/learners/{learnerId}/dashboard")
    public List<CourseOverview> getDashboard(@PathVariable String learnerId) {
        return progressQueryService.getDashboard(learnerId);
    }

    @PostMapping("/questions/evaluate")
    public QuestionEvaluation evaluateQuestion(@RequestBody QuestionEvaluationRequest request) {
        return questionQualityEvaluator.evaluate(request);
    }

    public record RegisterLearnerRequest(String displayName, String handle) {}

    public record CreateCourseRequest(
            String learnerId,
            String name,
            String description,
            Integer durationDays,
            Boolean custom
    ) {}

    public record GenerateQuestionsRequest(Integer count) {}

    public record SubmitAnswerRequest(String questionId, String answer) {}
}
