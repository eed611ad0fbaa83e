package org.example.learnpath.repository;

import org.example.learnpath.entity.CourseEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CourseRepository extends JpaRepository<CourseEntity, String> {

    Optional<CourseEntity> findByIdAndOwnerId(String id, String ownerId);

    List<CourseEntity> findByOwnerIdOrderByCreatedAtAsc(String ownerId);

    boolean existsByOwnerIdAndName(String ownerId, String name);
}
