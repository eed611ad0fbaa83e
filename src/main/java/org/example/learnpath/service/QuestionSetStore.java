package org.example.learnpath.service;

import org.example.learnpath.engine.DayStatusCalculator;
import org.example.learnpath.entity.CourseEntity;
import org.example.learnpath.entity.DayQuestionSetEntity;
import org.example.learnpath.entity.QuestionEntity;
import org.example.learnpath.model.DayStatus;
import org.example.learnpath.model.GenerationOutcome;
import org.example.learnpath.model.QuestionDraft;
import org.example.learnpath.repository.DayQuestionSetRepository;
import org.example.learnpath.repository.ProgressRecordRepository;
import org.example.learnpath.repository.QuestionRepository;
import org.example.learnpath.service.exception.DayAccessDeniedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Transactional writes of a day's question set. Kept apart from {@link DayProgressionService} so the
 * LLM call there runs outside any transaction.
 */
@Service
public class QuestionSetStore {

    private static final Logger log = LoggerFactory.getLogger(QuestionSetStore.class);

    private final DayQuestionSetRepository dayQuestionSetRepository;
    private final QuestionRepository questionRepository;
    private final ProgressRecordRepository progressRecordRepository;
    private final CourseProgressLoader courseProgressLoader;
    private final DayStatusCalculator dayStatusCalculator;

    public QuestionSetStore(
            DayQuestionSetRepository dayQuestionSetRepository,
            QuestionRepository questionRepository,
            ProgressRecordRepository progressRecordRepository,
            CourseProgressLoader courseProgressLoader,
            DayStatusCalculator dayStatusCalculator) {
        this.dayQuestionSetRepository = dayQuestionSetRepository;
        this.questionRepository = questionRepository;
        this.progressRecordRepository = progressRecordRepository;
        this.courseProgressLoader = courseProgressLoader;
        this.dayStatusCalculator = dayStatusCalculator;
    }

    /**
     * Inserts the set marker row and its questions. A unique-key violation on the marker surfaces as
     * {@link org.springframework.dao.DataIntegrityViolationException}: another request stored this day first.
     */
    @Transactional
    public List<QuestionEntity> createSet(CourseEntity course, int dayNumber, GenerationOutcome outcome) {
        DayQuestionSetEntity set = new DayQuestionSetEntity();
        set.setCourse(course);
        set.setDayNumber(dayNumber);
        set.setGeneratedAt(LocalDateTime.now());
        set.setModelName(outcome.modelName());
        set.setFallbackUsed(outcome.fallbackUsed());
        set.setGenerationCount(1);
        dayQuestionSetRepository.saveAndFlush(set);

        List<QuestionEntity> saved = questionRepository.saveAll(toEntities(course, dayNumber, outcome.questions()));
        log.info("Stored {} questions for course {} day {} (fallback={})",
                saved.size(), course.getId(), dayNumber, outcome.fallbackUsed());
        return saved;
    }

    /**
     * Replaces the day's questions and drops every progress record against the old ones. The day is
     * re-checked first; a day that is locked, completed or without questions is rejected with nothing written.
     */
    @Transactional
    public List<QuestionEntity> replaceSet(
            String learnerId,
            CourseEntity course,
            int dayNumber,
            GenerationOutcome outcome) {
        requireRegenerable(dayStatusCalculator.compute(courseProgressLoader.loadSnapshot(learnerId, course), dayNumber));

        int removedProgress = progressRecordRepository.deleteByCourseIdAndDayNumber(course.getId(), dayNumber);
        int removedQuestions = questionRepository.deleteByCourseIdAndDayNumber(course.getId(), dayNumber);

        DayQuestionSetEntity set = dayQuestionSetRepository.findByCourseIdAndDayNumber(course.getId(), dayNumber)
                .orElseThrow(() -> new IllegalStateException(
                        "Course " + course.getId() + " day " + dayNumber + " has questions but no question set"));
        set.setGeneratedAt(LocalDateTime.now());
        set.setModelName(outcome.modelName());
        set.setFallbackUsed(outcome.fallbackUsed());
        set.setGenerationCount(set.getGenerationCount() + 1);
        dayQuestionSetRepository.save(set);

        List<QuestionEntity> saved = questionRepository.saveAll(toEntities(course, dayNumber, outcome.questions()));
        log.info("Regenerated course {} day {}: removed {} questions and {} progress records, stored {}",
                course.getId(), dayNumber, removedQuestions, removedProgress, saved.size());
        return saved;
    }

    static void requireRegenerable(DayStatus status) {
        if (status.canRegenerate()) {
            return;
        }
        DayAccessDeniedException.Reason reason;
        if (!status.unlocked()) {
            reason = DayAccessDeniedException.Reason.DAY_LOCKED;
        } else if (status.completed()) {
            reason = DayAccessDeniedException.Reason.DAY_ALREADY_COMPLETED;
        } else {
            reason = DayAccessDeniedException.Reason.NO_QUESTIONS_YET;
        }
        throw new DayAccessDeniedException(reason, status.dayNumber());
    }

    private List<QuestionEntity> toEntities(CourseEntity course, int dayNumber, List<QuestionDraft> drafts) {
        List<QuestionEntity> entities = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            QuestionDraft draft = drafts.get(i);
            QuestionEntity entity = new QuestionEntity();
            entity.setCourse(course);
            entity.setDayNumber(dayNumber);
            entity.setPosition(i);
            entity.setQuestionText(draft.questionText());
            entity.setDifficulty(draft.difficulty());
            entity.setPoints(draft.points());
            entity.setCorrectAnswer(draft.correctAnswer());
            entity.setOptions(new ArrayList<>(draft.options()));
            entity.setExplanation(draft.explanation());
            entity.setQuestionType(draft.questionType());
            entity.setCodeSnippet(draft.codeSnippet());
            entities.add(entity);
        }
        return entities;
    }
}
