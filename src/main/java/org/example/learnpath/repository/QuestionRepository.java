package org.example.learnpath.repository;

import org.example.learnpath.entity.QuestionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface QuestionRepository extends JpaRepository<QuestionEntity, String> {

    List<QuestionEntity> findByCourseIdOrderByDayNumberAscPositionAsc(String courseId);

    List<QuestionEntity> findByCourseIdAndDayNumberOrderByPositionAsc(String courseId, int dayNumber);

    @Query("SELECT q.dayNumber AS dayNumber, q.id AS questionId FROM QuestionEntity q WHERE q.course.id = :courseId")
    List<DayQuestionId> findDayQuestionIds(@Param("courseId") String courseId);

    @Query("SELECT COALESCE(SUM(q.points), 0) FROM QuestionEntity q WHERE q.course.id = :courseId")
    long sumPointsByCourseId(@Param("courseId") String courseId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM QuestionEntity q WHERE q.course.id = :courseId AND q.dayNumber = :dayNumber")
    int deleteByCourseIdAndDayNumber(@Param("courseId") String courseId, @Param("dayNumber") int dayNumber);

    interface DayQuestionId {
        int getDayNumber();

        String getQuestionId();
    }
}
