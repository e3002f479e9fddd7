package clusterwatch.model;

import java.util.Locale;

/**
 * Partition availability.
 */
public enum PartitionStatus {
    UP,
    /** Also used for DRAIN and INACTIVE partitions, which accept no new work */
    DOWN,
    UNKNOWN;

    public static PartitionStatus fromScontrol(String state) {
        if (state == null) {
            return UNKNOWN;
        }
        return switch (state.trim().toUpperCase(Locale.ROOT)) {
            case "UP" -> UP;
            case "DOWN", "DRAIN", "INACTIVE" -> DOWN;
            default -> UNKNOWN;
        };
    }
}
