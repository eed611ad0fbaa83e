package org.example.learnpath.model;

import java.util.List;

/**
 * Day-by-day briefs for a course, one entry per day in order.
 *
 * @param fallbackDays number of days whose brief came from the deterministic template
 */
public record PlanOutline(
        List<PlanDay> days,
        int fallbackDays,
        String modelName
) {
    public PlanOutline {
        days = days == null ? List.of() : List.copyOf(days);
    }

    public boolean fallbackUsed() {
        return fallbackDays > 0;
    }
}
