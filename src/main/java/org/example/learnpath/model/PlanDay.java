package org.example.learnpath.model;

public record PlanDay(
        int dayNumber,
        String contentBrief
) {
}
