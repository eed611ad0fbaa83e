package org.example.learnpath.service;

import org.example.learnpath.config.LearningProperties;
import org.example.learnpath.engine.AnswerGrader;
import org.example.learnpath.entity.LearnerEntity;
import org.example.learnpath.entity.ProgressRecordEntity;
import org.example.learnpath.entity.QuestionEntity;
import org.example.learnpath.model.AnswerResult;
import org.example.learnpath.repository.LearnerRepository;
import org.example.learnpath.repository.ProgressRecordRepository;
import org.example.learnpath.repository.QuestionRepository;
import org.example.learnpath.service.exception.AttemptLimitExceededException;
import org.example.learnpath.service.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class AnswerSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(AnswerSubmissionService.class);

    private final LearnerRepository learnerRepository;
    private final QuestionRepository questionRepository;
    private final ProgressRecordRepository progressRecordRepository;
    private final AnswerGrader answerGrader;
    private final LearningMetricsService metricsService;
    private final ActivityRecorder activityRecorder;
    private final LearningProperties properties;
    private final TransactionTemplate transactionTemplate;

    public AnswerSubmissionService(
            LearnerRepository learnerRepository,
            QuestionRepository questionRepository,
            ProgressRecordRepository progressRecordRepository,
            AnswerGrader answerGrader,
            LearningMetricsService metricsService,
            ActivityRecorder activityRecorder,
            LearningProperties properties,
            TransactionTemplate transactionTemplate) {
        this.learnerRepository = learnerRepository;
        this.questionRepository = questionRepository;
        this.progressRecordRepository = progressRecordRepository;
        this.answerGrader = answerGrader;
        this.metricsService = metricsService;
        this.activityRecorder = activityRecorder;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Grades the answer and stores it as the learner's single record for the question. A later
     * submission overwrites the earlier result. When two first submissions race, the one that loses
     * the insert is applied as an overwrite of the winner's record.
     */
    public AnswerResult submitAnswer(String learnerId, String questionId, String answer) {
        if (answer == null || answer.isBlank()) {
            throw new IllegalArgumentException("Answer must not be blank");
        }

        RecordedAttempt attempt;
        try {
            attempt = transactionTemplate.execute(status -> recordAttempt(learnerId, questionId, answer));
        } catch (DataIntegrityViolationException e) {
            log.debug("Progress record for learner {} question {} inserted concurrently; overwriting it",
                    learnerId, questionId);
            attempt = transactionTemplate.execute(status -> recordAttempt(learnerId, questionId, answer));
        }

        QuestionEntity question = attempt.question();
        AnswerGrader.GradeResult grade = attempt.grade();
        metricsService.recordAnswerSubmitted(grade.correct());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("questionId", question.getId());
        details.put("courseId", question.getCourse().getId());
        details.put("dayNumber", question.getDayNumber());
        details.put("correct", grade.correct());
        details.put("earnedPoints", grade.earnedPoints());
        details.put("attempt", attempt.attemptCount());
        activityRecorder.record(attempt.learnerId(), "answer_submitted", details);

        return new AnswerResult(
                question.getId(),
                grade.correct(),
                grade.earnedPoints(),
                question.getCorrectAnswer(),
                question.getExplanation(),
                answerGrader.feedback(grade, question.getCorrectAnswer()),
                attempt.attemptCount()
        );
    }

    private RecordedAttempt recordAttempt(String learnerId, String questionId, String answer) {
        LearnerEntity learner = learnerRepository.findById(learnerId == null ? "" : learnerId)
                .orElseThrow(() -> new ResourceNotFoundException("Learner", String.valueOf(learnerId)));
        QuestionEntity question = questionRepository.findById(questionId == null ? "" : questionId)
                .filter(q -> learner.getId().equals(q.getCourse().getOwner().getId()))
                .orElseThrow(() -> new ResourceNotFoundException("Question", String.valueOf(questionId)));

        ProgressRecordEntity record = progressRecordRepository.findByLearnerIdAndQuestionId(learner.getId(), question.getId())
                .orElse(null);
        int maxAttempts = properties.getAnswers().getMaxAttempts();
        if (record != null && maxAttempts > 0 && record.getAttemptCount() >= maxAttempts) {
            metricsService.recordAttemptLimitRejected();
            throw new AttemptLimitExceededException(question.getId(), maxAttempts);
        }

        AnswerGrader.GradeResult grade = answerGrader.grade(answer, question.getCorrectAnswer(), question.getPoints());
        if (record == null) {
            record = new ProgressRecordEntity();
            record.setLearner(learner);
            record.setCourse(question.getCourse());
            record.setQuestion(question);
        }
        record.setCorrect(grade.correct());
        record.setEarnedPoints(grade.earnedPoints());
        record.setLastSubmittedAnswer(trimToLength(answerGrader.normalize(answer), 255));
        record.setAttemptCount(record.getAttemptCount() + 1);
        progressRecordRepository.saveAndFlush(record);
        return new RecordedAttempt(learner.getId(), question, grade, record.getAttemptCount());
    }

    private String trimToLength(String value, int maxLength) {
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }

    private record RecordedAttempt(
            String learnerId,
            QuestionEntity question,
            AnswerGrader.GradeResult grade,
            int attemptCount) {
    }
}
