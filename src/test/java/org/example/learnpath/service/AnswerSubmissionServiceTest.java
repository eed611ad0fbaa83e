package org.example.learnpath.service;

import org.example.learnpath.config.LearningProperties;
import org.example.learnpath.engine.AnswerGrader;
import org.example.learnpath.entity.CourseEntity;
import org.example.learnpath.entity.LearnerEntity;
import org.example.learnpath.entity.ProgressRecordEntity;
import org.example.learnpath.entity.QuestionEntity;
import org.example.learnpath.model.AnswerResult;
import org.example.learnpath.repository.LearnerRepository;
import org.example.learnpath.repository.ProgressRecordRepository;
import org.example.learnpath.repository.QuestionRepository;
import org.example.learnpath.service.exception.AttemptLimitExceededException;
import org.example.learnpath.service.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnswerSubmissionServiceTest {

    @Mock
    private LearnerRepository learnerRepository;

    @Mock
    private QuestionRepository questionRepository;

    @Mock
    private ProgressRecordRepository progressRecordRepository;

    @Mock
    private LearningMetricsService metricsService;

    @Mock
    private ActivityRecorder activityRecorder;

    @Mock
    private PlatformTransactionManager transactionManager;

    private LearningProperties properties;
    private LearnerEntity learner;
    private QuestionEntity question;
    private AnswerSubmissionService answerSubmissionService;

    @BeforeEach
    void setUp() {
        properties = new LearningProperties();
        learner = new LearnerEntity("Ada", "ada");
        learner.setId("learner-1");
        CourseEntity course = new CourseEntity(learner, "JavaScript", 3);
        course.setId("course-1");
        question = new QuestionEntity();
        question.setId("q-1");
        question.setCourse(course);
        question.setDayNumber(1);
        question.setPoints(15);
        question.setCorrectAnswer("B");
        question.setOptions(List.of("A) var", "B) const"));
        question.setExplanation("const cannot be reassigned.");

        answerSubmissionService = new AnswerSubmissionService(
                learnerRepository,
                questionRepository,
                progressRecordRepository,
                new AnswerGrader(),
                metricsService,
                activityRecorder,
                properties,
                new TransactionTemplate(transactionManager)
        );
    }

    @Test
    void submitAnswer_firstCorrectAnswer_createsRecordWithFullPoints() {
        stubLearnerAndQuestion();
        when(progressRecordRepository.findByLearnerIdAndQuestionId("learner-1", "q-1")).thenReturn(Optional.empty());

        AnswerResult result = answerSubmissionService.submitAnswer("learner-1", "q-1", " b ");

        assertTrue(result.correct());
        assertEquals(15, result.earnedPoints());
        assertEquals("B", result.correctAnswer());
        assertEquals("Correct! Well done!", result.feedback());
        assertEquals(1, result.attemptCount());

        ArgumentCaptor<ProgressRecordEntity> recordCaptor = ArgumentCaptor.forClass(ProgressRecordEntity.class);
        verify(progressRecordRepository).saveAndFlush(recordCaptor.capture());
        ProgressRecordEntity saved = recordCaptor.getValue();
        assertSame(learner, saved.getLearner());
        assertSame(question, saved.getQuestion());
        assertEquals("B", saved.getLastSubmittedAnswer());
        verify(metricsService).recordAnswerSubmitted(true);
        verify(activityRecorder).record(eq("learner-1"), eq("answer_submitted"), anyMap());
    }

    @Test
    void submitAnswer_resubmission_overwritesExistingRecord() {
        stubLearnerAndQuestion();
        ProgressRecordEntity existing = new ProgressRecordEntity();
        existing.setLearner(learner);
        existing.setQuestion(question);
        existing.setCourse(question.getCourse());
        existing.setCorrect(true);
        existing.setEarnedPoints(15);
        existing.setAttemptCount(1);
        when(progressRecordRepository.findByLearnerIdAndQuestionId("learner-1", "q-1")).thenReturn(Optional.of(existing));

        AnswerResult result = answerSubmissionService.submitAnswer("learner-1", "q-1", "A");

        assertFalse(result.correct());
        assertEquals(0, result.earnedPoints());
        assertEquals("Incorrect. The correct answer is: B", result.feedback());
        assertEquals(2, result.attemptCount());
        verify(progressRecordRepository).saveAndFlush(existing);
        assertFalse(existing.isCorrect());
        assertEquals(0, existing.getEarnedPoints());
        assertEquals("A", existing.getLastSubmittedAnswer());
    }

    @Test
    void submitAnswer_concurrentFirstSubmission_overwritesWinnersRecord() {
        stubLearnerAndQuestion();
        ProgressRecordEntity winner = new ProgressRecordEntity();
        winner.setLearner(learner);
        winner.setQuestion(question);
        winner.setCourse(question.getCourse());
        winner.setCorrect(false);
        winner.setLastSubmittedAnswer("A");
        winner.setAttemptCount(1);
        when(progressRecordRepository.findByLearnerIdAndQuestionId("learner-1", "q-1"))
                .thenReturn(Optional.empty(), Optional.of(winner));
        when(progressRecordRepository.saveAndFlush(any()))
                .thenThrow(new DataIntegrityViolationException("uk_progress_learner_question"))
                .thenAnswer(invocation -> invocation.getArgument(0));

        AnswerResult result = answerSubmissionService.submitAnswer("learner-1", "q-1", "B");

        assertTrue(result.correct());
        assertEquals(2, result.attemptCount());
        assertTrue(winner.isCorrect());
        assertEquals(15, winner.getEarnedPoints());
        assertEquals("B", winner.getLastSubmittedAnswer());
        verify(progressRecordRepository).saveAndFlush(winner);
        verify(metricsService).recordAnswerSubmitted(true);
    }

    @Test
    void submitAnswer_attemptLimitReached_rejectsWithoutSaving() {
        properties.getAnswers().setMaxAttempts(2);
        stubLearnerAndQuestion();
        ProgressRecordEntity existing = new ProgressRecordEntity();
        existing.setAttemptCount(2);
        when(progressRecordRepository.findByLearnerIdAndQuestionId("learner-1", "q-1")).thenReturn(Optional.of(existing));

        assertThrows(AttemptLimitExceededException.class,
                () -> answerSubmissionService.submitAnswer("learner-1", "q-1", "B"));

        verify(progressRecordRepository, never()).saveAndFlush(any());
        verify(metricsService).recordAttemptLimitRejected();
    }

    @Test
    void submitAnswer_questionOfAnotherLearner_throwsNotFound() {
        LearnerEntity other = new LearnerEntity("Grace", "grace");
        other.setId("learner-2");
        when(learnerRepository.findById("learner-2")).thenReturn(Optional.of(other));
        when(questionRepository.findById("q-1")).thenReturn(Optional.of(question));

        assertThrows(ResourceNotFoundException.class,
                () -> answerSubmissionService.submitAnswer("learner-2", "q-1", "B"));

        verifyNoInteractions(progressRecordRepository);
    }

    @Test
    void submitAnswer_unknownQuestion_throwsNotFound() {
        when(learnerRepository.findById("learner-1")).thenReturn(Optional.of(learner));
        when(questionRepository.findById("missing")).thenReturn(Optional.empty());

        ResourceNotFoundException error = assertThrows(ResourceNotFoundException.class,
                () -> answerSubmissionService.submitAnswer("learner-1", "missing", "B"));

        assertEquals("Question not found: missing", error.getMessage());
    }

    @Test
    void submitAnswer_blankAnswer_throwsBeforeAnyLookup() {
        assertThrows(IllegalArgumentException.class,
                () -> answerSubmissionService.submitAnswer("learner-1", "q-1", "  "));

        verifyNoInteractions(learnerRepository, questionRepository, progressRecordRepository);
    }

    private void stubLearnerAndQuestion() {
        when(learnerRepository.findById("learner-1")).thenReturn(Optional.of(learner));
        when(questionRepository.findById("q-1")).thenReturn(Optional.of(question));
    }
}
