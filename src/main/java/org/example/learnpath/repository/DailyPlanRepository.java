package org.example.learnpath.repository;

import org.example.learnpath.entity.DailyPlanEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DailyPlanRepository extends JpaRepository<DailyPlanEntity, String> {

    List<DailyPlanEntity> findByCourseIdOrderByDayNumberAsc(String courseId);

    Optional<DailyPlanEntity> findByCourseIdAndDayNumber(String courseId, int dayNumber);
}
