package org.example.learnpath.repository;

import org.example.learnpath.entity.LearnerEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LearnerRepository extends JpaRepository<LearnerEntity, String> {

    Optional<LearnerEntity> findByHandle(String handle);

    boolean existsByHandle(String handle);
}
