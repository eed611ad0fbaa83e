package org.example.learnpath.repository;

import org.example.learnpath.entity.ProgressRecordEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ProgressRecordRepository extends JpaRepository<ProgressRecordEntity, String> {

    Optional<ProgressRecordEntity> findByLearnerIdAndQuestionId(String learnerId, String questionId);

    List<ProgressRecordEntity> findByLearnerIdAndCourseId(String learnerId, String courseId);

    @Query("SELECT p.question.id FROM ProgressRecordEntity p WHERE p.learner.id = :learnerId AND p.course.id = :courseId")
    List<String> findAnsweredQuestionIds(@Param("learnerId") String learnerId, @Param("courseId") String courseId);

    long countByLearnerIdAndCourseId(String learnerId, String courseId);

    long countByLearnerIdAndCourseIdAndCorrectTrue(String learnerId, String courseId);

    @Query("SELECT p FROM ProgressRecordEntity p WHERE p.learner.id = :learnerId AND p.course.id = :courseId "
            + "ORDER BY p.updatedAt DESC, p.createdAt DESC")
    List<ProgressRecordEntity> findRecent(
            @Param("learnerId") String learnerId,
            @Param("courseId") String courseId,
            Pageable pageable);

    @Query("SELECT COALESCE(SUM(p.earnedPoints), 0) FROM ProgressRecordEntity p WHERE p.learner.id = :learnerId AND p.course.id = :courseId")
    long sumEarnedPoints(@Param("learnerId") String learnerId, @Param("courseId") String courseId);

    @Query("SELECT MAX(p.updatedAt) FROM ProgressRecordEntity p WHERE p.learner.id = :learnerId AND p.course.id = :courseId")
    Optional<LocalDateTime> findLastActivity(@Param("learnerId") String learnerId, @Param("courseId") String courseId);

    @Query("SELECT COUNT(p) FROM ProgressRecordEntity p WHERE p.question.course.id = :courseId AND p.question.dayNumber = :dayNumber")
    long countByCourseIdAndDayNumber(@Param("courseId") String courseId, @Param("dayNumber") int dayNumber);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ProgressRecordEntity p WHERE p.question.id IN "
            + "(SELECT q.id FROM QuestionEntity q WHERE q.course.id = :courseId AND q.dayNumber = :dayNumber)")
    int deleteByCourseIdAndDayNumber(@Param("courseId") String courseId, @Param("dayNumber") int dayNumber);
}
