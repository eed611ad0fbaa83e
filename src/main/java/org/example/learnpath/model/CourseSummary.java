package org.example.learnpath.model;

import java.time.LocalDateTime;

public record CourseSummary(
        String id,
        String ownerLearnerId,
        String name,
        String description,
        int durationDays,
        boolean custom,
        boolean planFallbackUsed,
        LocalDateTime createdAt
) {
}
