package org.example.learnpath.model;

import java.time.LocalDateTime;

public record LearnerProfile(
        String id,
        String displayName,
        String handle,
        LocalDateTime createdAt
) {
}
