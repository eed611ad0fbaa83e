package org.example.learnpath.service;

import org.example.learnpath.config.LearningProperties;
import org.example.learnpath.engine.DayStatusCalculator;
import org.example.learnpath.entity.CourseEntity;
import org.example.learnpath.entity.DailyPlanEntity;
import org.example.learnpath.entity.ProgressRecordEntity;
import org.example.learnpath.entity.QuestionEntity;
import org.example.learnpath.model.CourseProgressSnapshot;
import org.example.learnpath.model.DayStatus;
import org.example.learnpath.model.GenerationOutcome;
import org.example.learnpath.model.QuestionReview;
import org.example.learnpath.model.QuestionView;
import org.example.learnpath.model.RegenerationPreferences;
import org.example.learnpath.repository.DailyPlanRepository;
import org.example.learnpath.repository.ProgressRecordRepository;
import org.example.learnpath.repository.QuestionRepository;
import org.example.learnpath.service.exception.DayAccessDeniedException;
import org.example.learnpath.service.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Day-gated access to a course: status, first-time generation, regeneration and review.
 */
@Service
public class DayProgressionService {

    private static final Logger log = LoggerFactory.getLogger(DayProgressionService.class);

    private final CourseProgressLoader courseProgressLoader;
    private final DayStatusCalculator dayStatusCalculator;
    private final AdaptiveQuestionGenerator questionGenerator;
    private final QuestionSetStore questionSetStore;
    private final QuestionRepository questionRepository;
    private final DailyPlanRepository dailyPlanRepository;
    private final ProgressRecordRepository progressRecordRepository;
    private final LearningMetricsService metricsService;
    private final ActivityRecorder activityRecorder;
    private final LearningProperties properties;

    public DayProgressionService(
            CourseProgressLoader courseProgressLoader,
            DayStatusCalculator dayStatusCalculator,
            AdaptiveQuestionGenerator questionGenerator,
            QuestionSetStore questionSetStore,
            QuestionRepository questionRepository,
            DailyPlanRepository dailyPlanRepository,
            ProgressRecordRepository progressRecordRepository,
            LearningMetricsService metricsService,
            ActivityRecorder activityRecorder,
            LearningProperties properties) {
        this.courseProgressLoader = courseProgressLoader;
        this.dayStatusCalculator = dayStatusCalculator;
        this.questionGenerator = questionGenerator;
        this.questionSetStore = questionSetStore;
        this.questionRepository = questionRepository;
        this.dailyPlanRepository = dailyPlanRepository;
        this.progressRecordRepository = progressRecordRepository;
        this.metricsService = metricsService;
        this.activityRecorder = activityRecorder;
        this.properties = properties;
    }

    @Transactional(readOnly = true)
    public DayStatus computeDayStatus(String learnerId, String courseId, int dayNumber) {
        CourseEntity course = courseProgressLoader.requireOwnedCourse(learnerId, courseId);
        CourseProgressSnapshot snapshot = courseProgressLoader.loadSnapshot(learnerId, course);
        return dayStatusCalculator.compute(snapshot, dayNumber);
    }

    @Transactional(readOnly = true)
    public List<DayStatus> getCourseDayStatuses(String learnerId, String courseId) {
        CourseEntity course = courseProgressLoader.requireOwnedCourse(learnerId, courseId);
        return dayStatusCalculator.computeAll(courseProgressLoader.loadSnapshot(learnerId, course));
    }

    /**
     * Returns the day's questions, generating them on first access. Repeated calls return the stored set.
     *
     * @param count number of questions to request; null uses the configured default
     */
    public List<QuestionView> generateQuestionsForDay(String learnerId, String courseId, int dayNumber, Integer count) {
        int numQuestions = resolveCount(count);
        CourseEntity course = courseProgressLoader.requireOwnedCourse(learnerId, courseId);
        DayStatus status = dayStatusCalculator.compute(courseProgressLoader.loadSnapshot(learnerId, course), dayNumber);
        if (!status.unlocked()) {
            throw new DayAccessDeniedException(DayAccessDeniedException.Reason.DAY_LOCKED, dayNumber);
        }

        List<QuestionEntity> existing = questionRepository.findByCourseIdAndDayNumberOrderByPositionAsc(courseId, dayNumber);
        if (!existing.isEmpty()) {
            log.debug("Returning {} existing questions for course {} day {}", existing.size(), courseId, dayNumber);
            return toViews(learnerId, courseId, existing);
        }

        String brief = requirePlan(courseId, dayNumber).getContentBrief();
        GenerationOutcome outcome = runGeneration(() -> questionGenerator.generate(
                adaptiveRequest(learnerId, course, dayNumber, brief, numQuestions)));

        List<QuestionEntity> stored;
        try {
            stored = questionSetStore.createSet(course, dayNumber, outcome);
        } catch (DataIntegrityViolationException e) {
            metricsService.recordGenerationRaceLost();
            log.info("Questions for course {} day {} were stored by a concurrent request; discarding {} drafts",
                    courseId, dayNumber, outcome.questions().size());
            stored = questionRepository.findByCourseIdAndDayNumberOrderByPositionAsc(courseId, dayNumber);
        }

        activityRecorder.record(learnerId, "questions_generated", activityDetails(courseId, dayNumber, outcome, stored.size()));
        return toViews(learnerId, courseId, stored);
    }

    /**
     * Replaces the questions of an open day that already has a set with a freshly generated set shaped by the learner's preferences.
     * Progress against the old questions is discarded.
     */
    public List<QuestionView> regenerateQuestionsForDay(
            String learnerId,
            String courseId,
            int dayNumber,
            RegenerationPreferences preferences) {
        RegenerationPreferences prefs = preferences == null ? RegenerationPreferences.defaults() : preferences;
        int numQuestions = resolveCount(prefs.numQuestions());
        CourseEntity course = courseProgressLoader.requireOwnedCourse(learnerId, courseId);
        QuestionSetStore.requireRegenerable(
                dayStatusCalculator.compute(courseProgressLoader.loadSnapshot(learnerId, course), dayNumber));

        String brief = requirePlan(courseId, dayNumber).getContentBrief();
        AdaptiveQuestionGenerator.CustomQuestionRequest request = new AdaptiveQuestionGenerator.CustomQuestionRequest(
                adaptiveRequest(learnerId, course, dayNumber, brief, numQuestions),
                prefs.focusAreas(),
                prefs.difficultyPreference(),
                prefs.questionTypes(),
                prefs.specialInstructions()
        );
        GenerationOutcome outcome = runGeneration(() -> questionGenerator.generateCustom(request));

        List<QuestionEntity> stored = questionSetStore.replaceSet(learnerId, course, dayNumber, outcome);
        metricsService.recordRegenerationCompleted();

        Map<String, Object> details = activityDetails(courseId, dayNumber, outcome, stored.size());
        details.put("difficultyPreference", AdaptiveQuestionGenerator.DifficultyPreference
                .parse(prefs.difficultyPreference()).name().toLowerCase(Locale.ROOT));
        details.put("focusAreas", prefs.focusAreas());
        activityRecorder.record(learnerId, "questions_regenerated", details);
        return toViews(learnerId, courseId, stored);
    }

    /**
     * Questions of a completed day with their answers, explanations and the learner's submissions.
     */
    @Transactional(readOnly = true)
    public List<QuestionReview> getDayReview(String learnerId, String courseId, int dayNumber) {
        CourseEntity course = courseProgressLoader.requireOwnedCourse(learnerId, courseId);
        DayStatus status = dayStatusCalculator.compute(courseProgressLoader.loadSnapshot(learnerId, course), dayNumber);
        if (!status.completed()) {
            throw new DayAccessDeniedException(DayAccessDeniedException.Reason.DAY_NOT_COMPLETED, dayNumber);
        }

        Map<String, ProgressRecordEntity> progressByQuestion = progressByQuestion(learnerId, courseId);
        return questionRepository.findByCourseIdAndDayNumberOrderByPositionAsc(courseId, dayNumber).stream()
                .map(question -> {
                    ProgressRecordEntity record = progressByQuestion.get(question.getId());
                    return new QuestionReview(
                            question.getId(),
                            question.getDayNumber(),
                            question.getQuestionText(),
                            question.getDifficulty(),
                            question.getPoints(),
                            List.copyOf(question.getOptions()),
                            question.getQuestionType(),
                            question.getCodeSnippet(),
                            question.getCorrectAnswer(),
                            question.getExplanation(),
                            record == null ? null : record.getLastSubmittedAnswer(),
                            record != null && record.isCorrect(),
                            record == null ? 0 : record.getEarnedPoints()
                    );
                })
                .toList();
    }

    private GenerationOutcome runGeneration(Supplier<GenerationOutcome> generation) {
        metricsService.recordGenerationRequested();
        long startedAtMs = System.currentTimeMillis();
        try {
            GenerationOutcome outcome = generation.get();
            metricsService.recordGenerationCompleted(outcome.fallbackUsed(), Math.max(0L, System.currentTimeMillis() - startedAtMs));
            return outcome;
        } catch (RuntimeException e) {
            metricsService.recordGenerationFailed(Math.max(0L, System.currentTimeMillis() - startedAtMs));
            throw e;
        }
    }

    private AdaptiveQuestionGenerator.AdaptiveQuestionRequest adaptiveRequest(
            String learnerId,
            CourseEntity course,
            int dayNumber,
            String brief,
            int numQuestions) {
        CourseProgressLoader.AccuracyStats stats = courseProgressLoader.loadAccuracy(
                learnerId, course.getId(), properties.getGeneration().getRecentWindow());
        return new AdaptiveQuestionGenerator.AdaptiveQuestionRequest(
                course.getName(),
                dayNumber,
                course.getDurationDays(),
                brief,
                stats.overallAccuracy(),
                stats.recentAccuracy(),
                stats.totalAnswered(),
                numQuestions
        );
    }

    private DailyPlanEntity requirePlan(String courseId, int dayNumber) {
        return dailyPlanRepository.findByCourseIdAndDayNumber(courseId, dayNumber)
                .orElseThrow(() -> new ResourceNotFoundException("DailyPlan", courseId + "/day-" + dayNumber));
    }

    private int resolveCount(Integer count) {
        LearningProperties.Generation generation = properties.getGeneration();
        int resolved = count == null ? generation.getDefaultQuestionCount() : count;
        if (resolved < generation.getMinQuestionCount() || resolved > generation.getMaxQuestionCount()) {
            throw new IllegalArgumentException("Question count must be between "
                    + generation.getMinQuestionCount() + " and " + generation.getMaxQuestionCount());
        }
        return resolved;
    }

    private List<QuestionView> toViews(String learnerId, String courseId, List<QuestionEntity> questions) {
        Set<String> answered = new HashSet<>(progressRecordRepository.findAnsweredQuestionIds(learnerId, courseId));
        return questions.stream()
                .map(question -> new QuestionView(
                        question.getId(),
                        question.getDayNumber(),
                        question.getQuestionText(),
                        question.getDifficulty(),
                        question.getPoints(),
                        List.copyOf(question.getOptions()),
                        question.getQuestionType(),
                        question.getCodeSnippet(),
                        answered.contains(question.getId())
                ))
                .toList();
    }

    private Map<String, ProgressRecordEntity> progressByQuestion(String learnerId, String courseId) {
        return progressRecordRepository.findByLearnerIdAndCourseId(learnerId, courseId).stream()
                .collect(Collectors.toMap(record -> record.getQuestion().getId(), Function.identity(), (a, b) -> a));
    }

    private Map<String, Object> activityDetails(String courseId, int dayNumber, GenerationOutcome outcome, int stored) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("courseId", courseId);
        details.put("dayNumber", dayNumber);
        details.put("questions", stored);
        details.put("fallbackUsed", outcome.fallbackUsed());
        details.put("model", outcome.modelName());
        if (outcome.failureReason() != null) {
            details.put("failureReason", outcome.failureReason());
        }
        return details;
    }
}
