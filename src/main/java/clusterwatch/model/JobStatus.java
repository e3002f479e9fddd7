package clusterwatch.model;

import java.util.Locale;

/**
 * Scheduler job state as observed from scontrol.
 */
public enum JobStatus {
    /** Waiting for resources */
    PENDING,
    /** Allocated and running */
    RUNNING,
    /** Finished with exit code zero */
    COMPLETED,
    /** Finished with a non-zero exit code */
    FAILED,
    /** Cancelled by a user or administrator */
    CANCELLED,
    /** Any other state (COMPLETING, TIMEOUT, PREEMPTED, ...) */
    UNKNOWN;

    public static JobStatus fromScontrol(String state) {
        if (state == null) {
            return UNKNOWN;
        }
        return switch (state.trim().toUpperCase(Locale.ROOT)) {
            case "PENDING" -> PENDING;
            case "RUNNING" -> RUNNING;
            case "COMPLETED" -> COMPLETED;
            case "FAILED" -> FAILED;
            case "CANCELLED" -> CANCELLED;
            default -> UNKNOWN;
        };
    }
}
