package dev.leaddispatch.model;

import java.util.Locale;

/**
 * Status of a dispatch job.
 */
public enum JobStatus {
    DISPATCHED,
    COMPLETE,
    PAID,
    CANCELLED;

    /**
     * Check whether a job in this status may move to {@code target}.
     */
    public boolean canTransitionTo(JobStatus target) {
        return switch (this) {
            case DISPATCHED -> target == COMPLETE || target == CANCELLED;
            case COMPLETE -> target == PAID;
            case PAID, CANCELLED -> false;
        };
    }

    /**
     * Parse a user supplied status ("dispatched", "Complete", ...).
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static JobStatus fromText(String text) {
        return valueOf(text.trim().toUpperCase(Locale.ROOT));
    }
}
