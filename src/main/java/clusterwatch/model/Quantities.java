package clusterwatch.model;

/**
 * Arithmetic on unsigned resource quantities.
 */
public final class Quantities {

    private Quantities() {
    }

    /**
     * {@code total - allocated}, clamped at zero. The scheduler can transiently report more
     * allocated than configured; the result never goes negative.
     */
    public static long saturatingSubtract(long total, long allocated) {
        if (allocated >= total) {
            return 0L;
        }
        return total - Math.max(0L, allocated);
    }

    public static int saturatingSubtract(int total, int allocated) {
        return (int) saturatingSubtract((long) total, (long) allocated);
    }
}
