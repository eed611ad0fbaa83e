package org.example.learnpath.repository;

import org.example.learnpath.entity.DayQuestionSetEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DayQuestionSetRepository extends JpaRepository<DayQuestionSetEntity, String> {

    Optional<DayQuestionSetEntity> findByCourseIdAndDayNumber(String courseId, int dayNumber);
}
