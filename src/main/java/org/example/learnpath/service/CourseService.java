package org.example.learnpath.service;

import org.example.learnpath.entity.CourseEntity;
import org.example.learnpath.entity.DailyPlanEntity;
import org.example.learnpath.entity.LearnerEntity;
import org.example.learnpath.model.CourseSummary;
import org.example.learnpath.model.PlanDay;
import org.example.learnpath.model.PlanOutline;
import org.example.learnpath.repository.CourseRepository;
import org.example.learnpath.repository.DailyPlanRepository;
import org.example.learnpath.repository.LearnerRepository;
import org.example.learnpath.service.exception.DuplicateResourceException;
import org.example.learnpath.service.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Course creation with its study plan. The plan outline is generated before the write transaction opens.
 */
@Service
public class CourseService {

    private static final Logger log = LoggerFactory.getLogger(CourseService.class);
    private static final int MAX_DURATION_DAYS = 365;

    private final LearnerRepository learnerRepository;
    private final CourseRepository courseRepository;
    private final DailyPlanRepository dailyPlanRepository;
    private final StudyPlanBootstrapper studyPlanBootstrapper;
    private final LearningMetricsService metricsService;
    private final ActivityRecorder activityRecorder;
    private final TransactionTemplate transactionTemplate;

    public CourseService(
            LearnerRepository learnerRepository,
            CourseRepository courseRepository,
            DailyPlanRepository dailyPlanRepository,
            StudyPlanBootstrapper studyPlanBootstrapper,
            LearningMetricsService metricsService,
            ActivityRecorder activityRecorder,
            TransactionTemplate transactionTemplate) {
        this.learnerRepository = learnerRepository;
        this.courseRepository = courseRepository;
        this.dailyPlanRepository = dailyPlanRepository;
        this.studyPlanBootstrapper = studyPlanBootstrapper;
        this.metricsService = metricsService;
        this.activityRecorder = activityRecorder;
        this.transactionTemplate = transactionTemplate;
    }

    public CourseSummary createCourse(
            String learnerId,
            String name,
            String description,
            int durationDays,
            boolean custom) {
        String courseName = LearnerService.requireText(name, "name", 200);
        if (durationDays < 1 || durationDays > MAX_DURATION_DAYS) {
            throw new IllegalArgumentException("durationDays must be between 1 and " + MAX_DURATION_DAYS);
        }
        LearnerEntity owner = learnerRepository.findById(learnerId == null ? "" : learnerId)
                .orElseThrow(() -> new ResourceNotFoundException("Learner", String.valueOf(learnerId)));
        if (courseRepository.existsByOwnerIdAndName(owner.getId(), courseName)) {
            throw new DuplicateResourceException("Course already exists for this learner: " + courseName);
        }

        PlanOutline outline = studyPlanBootstrapper.bootstrap(courseName, durationDays);
        metricsService.recordPlanFallbackDays(outline.fallbackDays());

        CourseEntity saved;
        try {
            saved = transactionTemplate.execute(status -> {
                CourseEntity course = new CourseEntity(owner, courseName, durationDays);
                course.setDescription(description == null || description.isBlank() ? null : description.strip());
                course.setCustom(custom);
                course.setPlanFallbackUsed(outline.fallbackUsed());
                CourseEntity persisted = courseRepository.saveAndFlush(course);
                for (PlanDay day : outline.days()) {
                    dailyPlanRepository.save(new DailyPlanEntity(persisted, day.dayNumber(), day.contentBrief()));
                }
                return persisted;
            });
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateResourceException("Course already exists for this learner: " + courseName, e);
        }

        log.info("Created course {} ({} days) for learner {} (plan fallback days={})",
                courseName, durationDays, owner.getId(), outline.fallbackDays());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("courseId", saved.getId());
        details.put("courseName", courseName);
        details.put("durationDays", durationDays);
        details.put("aiGenerated", !outline.fallbackUsed());
        details.put("fallbackDays", outline.fallbackDays());
        activityRecorder.record(owner.getId(), "study_plan_generated", details);
        return toSummary(saved, owner.getId());
    }

    @Transactional(readOnly = true)
    public List<PlanDay> getPlan(String learnerId, String courseId) {
        CourseEntity course = courseRepository.findByIdAndOwnerId(courseId, learnerId)
                .orElseThrow(() -> new ResourceNotFoundException("Course", courseId));
        return dailyPlanRepository.findByCourseIdOrderByDayNumberAsc(course.getId()).stream()
                .map(plan -> new PlanDay(plan.getDayNumber(), plan.getContentBrief()))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<CourseSummary> listCourses(String learnerId) {
        if (learnerId == null || !learnerRepository.existsById(learnerId)) {
            throw new ResourceNotFoundException("Learner", String.valueOf(learnerId));
        }
        return courseRepository.findByOwnerIdOrderByCreatedAtAsc(learnerId).stream()
                .map(course -> toSummary(course, learnerId))
                .toList();
    }

    private CourseSummary toSummary(CourseEntity course, String ownerId) {
        return new CourseSummary(
                course.getId(),
                ownerId,
                course.getName(),
                course.getDescription(),
                course.getDurationDays(),
                course.isCustom(),
                course.isPlanFallbackUsed(),
                course.getCreatedAt()
        );
    }
}
