package org.example.learnpath.service;

import org.example.learnpath.entity.CourseEntity;
import org.example.learnpath.entity.ProgressRecordEntity;
import org.example.learnpath.model.CourseProgressSnapshot;
import org.example.learnpath.repository.CourseRepository;
import org.example.learnpath.repository.LearnerRepository;
import org.example.learnpath.repository.ProgressRecordRepository;
import org.example.learnpath.repository.QuestionRepository;
import org.example.learnpath.service.exception.ResourceNotFoundException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reads the rows behind day-status decisions. Runs inside the caller's transaction when there is one.
 */
@Component
public class CourseProgressLoader {

    private final LearnerRepository learnerRepository;
    private final CourseRepository courseRepository;
    private final QuestionRepository questionRepository;
    private final ProgressRecordRepository progressRecordRepository;

    public CourseProgressLoader(
            LearnerRepository learnerRepository,
            CourseRepository courseRepository,
            QuestionRepository questionRepository,
            ProgressRecordRepository progressRecordRepository) {
        this.learnerRepository = learnerRepository;
        this.courseRepository = courseRepository;
        this.questionRepository = questionRepository;
        this.progressRecordRepository = progressRecordRepository;
    }

    /**
     * @throws ResourceNotFoundException if the learner does not exist, or the course does not exist or
     *                                   belongs to another learner
     */
    public CourseEntity requireOwnedCourse(String learnerId, String courseId) {
        requireLearner(learnerId);
        return courseRepository.findByIdAndOwnerId(courseId, learnerId)
                .orElseThrow(() -> new ResourceNotFoundException("Course", courseId));
    }

    public void requireLearner(String learnerId) {
        if (learnerId == null || !learnerRepository.existsById(learnerId)) {
            throw new ResourceNotFoundException("Learner", String.valueOf(learnerId));
        }
    }

    public CourseProgressSnapshot loadSnapshot(String learnerId, CourseEntity course) {
        Map<Integer, List<String>> questionIdsByDay = new TreeMap<>();
        for (QuestionRepository.DayQuestionId row : questionRepository.findDayQuestionIds(course.getId())) {
            questionIdsByDay.computeIfAbsent(row.getDayNumber(), day -> new ArrayList<>()).add(row.getQuestionId());
        }
        Set<String> answered = new HashSet<>(progressRecordRepository.findAnsweredQuestionIds(learnerId, course.getId()));
        return new CourseProgressSnapshot(course.getDurationDays(), questionIdsByDay, answered);
    }

    public AccuracyStats loadAccuracy(String learnerId, String courseId, int recentWindow) {
        long total = progressRecordRepository.countByLearnerIdAndCourseId(learnerId, courseId);
        long correct = progressRecordRepository.countByLearnerIdAndCourseIdAndCorrectTrue(learnerId, courseId);
        List<ProgressRecordEntity> recent = progressRecordRepository.findRecent(
                learnerId, courseId, PageRequest.of(0, Math.max(1, recentWindow)));
        long recentCorrect = recent.stream().filter(ProgressRecordEntity::isCorrect).count();
        return new AccuracyStats(
                percentage(correct, total),
                percentage(recentCorrect, recent.size()),
                (int) total
        );
    }

    private double percentage(long part, long whole) {
        return whole == 0 ? 0.0 : part * 100.0 / whole;
    }

    public record AccuracyStats(double overallAccuracy, double recentAccuracy, int totalAnswered) {
    }
}
