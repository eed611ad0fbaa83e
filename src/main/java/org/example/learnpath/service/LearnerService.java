package org.example.learnpath.service;

import org.example.learnpath.entity.LearnerEntity;
import org.example.learnpath.model.LearnerProfile;
import org.example.learnpath.repository.LearnerRepository;
import org.example.learnpath.service.exception.DuplicateResourceException;
import org.example.learnpath.service.exception.ResourceNotFoundException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

@Service
public class LearnerService {

    private static final int MAX_HANDLE_LENGTH = 120;
    private static final int MAX_NAME_LENGTH = 200;

    private final LearnerRepository learnerRepository;
    private final ActivityRecorder activityRecorder;

    public LearnerService(LearnerRepository learnerRepository, ActivityRecorder activityRecorder) {
        this.learnerRepository = learnerRepository;
        this.activityRecorder = activityRecorder;
    }

    @Transactional
    public LearnerProfile registerLearner(String displayName, String handle) {
        String normalizedName = requireText(displayName, "displayName", MAX_NAME_LENGTH);
        String normalizedHandle = requireText(handle, "handle", MAX_HANDLE_LENGTH);
        if (learnerRepository.existsByHandle(normalizedHandle)) {
            activityRecorder.record(null, "registration_failed", Map.of("handle", normalizedHandle, "reason", "handle_exists"));
            throw new DuplicateResourceException("Handle already exists: " + normalizedHandle);
        }
        LearnerEntity saved;
        try {
            saved = learnerRepository.saveAndFlush(new LearnerEntity(normalizedName, normalizedHandle));
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateResourceException("Handle already exists: " + normalizedHandle, e);
        }
        activityRecorder.record(saved.getId(), "learner_registered", Map.of("handle", normalizedHandle));
        return toProfile(saved);
    }

    @Transactional(readOnly = true)
    public LearnerProfile getLearner(String learnerId) {
        return learnerRepository.findById(learnerId)
                .map(this::toProfile)
                .orElseThrow(() -> new ResourceNotFoundException("Learner", learnerId));
    }

    @Transactional(readOnly = true)
    public LearnerProfile getLearnerByHandle(String handle) {
        return learnerRepository.findByHandle(handle == null ? "" : handle.strip())
                .map(this::toProfile)
                .orElseThrow(() -> new ResourceNotFoundException("Learner", handle));
    }

    private LearnerProfile toProfile(LearnerEntity entity) {
        return new LearnerProfile(entity.getId(), entity.getDisplayName(), entity.getHandle(), entity.getCreatedAt());
    }

    static String requireText(String value, String field, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        String trimmed = value.strip();
        if (trimmed.length() > maxLength) {
            throw new IllegalArgumentException(field + " must be at most " + maxLength + " characters");
        }
        return trimmed;
    }
}
