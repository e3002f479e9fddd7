package clusterwatch.model;

import java.util.Locale;

/**
 * Scheduling state of a compute node.
 */
public enum NodeStatus {
    /** No job running on the node */
    IDLE,
    /** All CPUs allocated */
    ALLOC,
    /** Some CPUs allocated */
    MIX,
    /** Node is unavailable */
    DOWN,
    /** Any state not listed above */
    UNKNOWN;

    /**
     * Map scontrol's {@code State=} text. Flags such as {@code IDLE+DRAIN} or a trailing
     * {@code *} are ignored; unrecognized states map to {@link #UNKNOWN}.
     */
    public static NodeStatus fromScontrol(String state) {
        if (state == null) {
            return UNKNOWN;
        }
        String base = state.trim().toUpperCase(Locale.ROOT);
        int plus = base.indexOf('+');
        if (plus >= 0) {
            base = base.substring(0, plus);
        }
        int end = base.length();
        while (end > 0 && !Character.isLetter(base.charAt(end - 1))) {
            end--;
        }
        return switch (base.substring(0, end)) {
            case "IDLE" -> IDLE;
            case "ALLOC", "ALLOCATED" -> ALLOC;
            case "MIX", "MIXED" -> MIX;
            case "DOWN" -> DOWN;
            default -> UNKNOWN;
        };
    }
}
