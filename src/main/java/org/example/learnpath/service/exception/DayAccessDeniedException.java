package org.example.learnpath.service.exception;

/**
 * The requested day exists but its current state does not allow the operation.
 */
public class DayAccessDeniedException extends RuntimeException {

    public enum Reason {
        /** The previous day is not completed yet. */
        DAY_LOCKED,
        /** Completed days keep their questions. */
        DAY_ALREADY_COMPLETED,
        /** Regeneration needs an existing question set to replace. */
        NO_QUESTIONS_YET,
        /** Answers are only revealed once every question of the day is answered. */
        DAY_NOT_COMPLETED
    }

    private final Reason reason;
    private final int dayNumber;

    public DayAccessDeniedException(Reason reason, int dayNumber) {
        super(describe(reason, dayNumber));
        this.reason = reason;
        this.dayNumber = dayNumber;
    }

    public Reason getReason() {
        return reason;
    }

    public int getDayNumber() {
        return dayNumber;
    }

    private static String describe(Reason reason, int dayNumber) {
        return switch (reason) {
            case DAY_LOCKED -> "Day " + dayNumber + " is locked. Complete the previous day first.";
            case DAY_ALREADY_COMPLETED -> "Day " + dayNumber + " is already completed and cannot be regenerated.";
            case NO_QUESTIONS_YET -> "Day " + dayNumber + " has no questions yet. Generate them before regenerating.";
            case DAY_NOT_COMPLETED -> "Day " + dayNumber + " must be completed before it can be reviewed.";
        };
    }
}
