package org.example.learnpath.service;

import org.example.learnpath.engine.DayStatusCalculator;
import org.example.learnpath.engine.ProgressAggregator;
import org.example.learnpath.entity.CourseEntity;
import org.example.learnpath.model.CourseOverview;
import org.example.learnpath.model.DayStatus;
import org.example.learnpath.model.ProgressSummary;
import org.example.learnpath.repository.CourseRepository;
import org.example.learnpath.repository.ProgressRecordRepository;
import org.example.learnpath.repository.QuestionRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class ProgressQueryService {

    private final CourseProgressLoader courseProgressLoader;
    private final DayStatusCalculator dayStatusCalculator;
    private final ProgressAggregator progressAggregator;
    private final CourseRepository courseRepository;
    private final QuestionRepository questionRepository;
    private final ProgressRecordRepository progressRecordRepository;

    public ProgressQueryService(
            CourseProgressLoader courseProgressLoader,
            DayStatusCalculator dayStatusCalculator,
            ProgressAggregator progressAggregator,
            CourseRepository courseRepository,
            QuestionRepository questionRepository,
            ProgressRecordRepository progressRecordRepository) {
        this.courseProgressLoader = courseProgressLoader;
        this.dayStatusCalculator = dayStatusCalculator;
        this.progressAggregator = progressAggregator;
        this.courseRepository = courseRepository;
        this.questionRepository = questionRepository;
        this.progressRecordRepository = progressRecordRepository;
    }

    @Transactional(readOnly = true)
    public ProgressSummary getCourseProgress(String learnerId, String courseId) {
        CourseEntity course = courseProgressLoader.requireOwnedCourse(learnerId, courseId);
        return summarize(learnerId, course);
    }

    /**
     * One overview per course the learner owns, oldest course first.
     */
    @Transactional(readOnly = true)
    public List<CourseOverview> getDashboard(String learnerId) {
        courseProgressLoader.requireLearner(learnerId);
        return courseRepository.findByOwnerIdOrderByCreatedAtAsc(learnerId).stream()
                .map(course -> {
                    ProgressSummary summary = summarize(learnerId, course);
                    String lastActivity = progressAggregator.describeLastActivity(
                            progressRecordRepository.findLastActivity(learnerId, course.getId()).orElse(null));
                    return new CourseOverview(
                            course.getId(),
                            course.getName(),
                            course.getDescription(),
                            course.getDurationDays(),
                            course.isCustom(),
                            summary.currentDay(),
                            summary.completionPercentage(),
                            summary.earnedPoints(),
                            summary.totalPoints(),
                            summary.completedDays(),
                            lastActivity
                    );
                })
                .toList();
    }

    private ProgressSummary summarize(String learnerId, CourseEntity course) {
        List<DayStatus> statuses = dayStatusCalculator.computeAll(courseProgressLoader.loadSnapshot(learnerId, course));
        return progressAggregator.summarize(
                course.getId(),
                course.getDurationDays(),
                statuses,
                (int) questionRepository.sumPointsByCourseId(course.getId()),
                (int) progressRecordRepository.sumEarnedPoints(learnerId, course.getId())
        );
    }
}
