package clusterwatch.collector;

/**
 * Collecting one resource class ({@code nodes}, {@code partitions} or {@code jobs}) failed:
 * scontrol could not be started, exited non-zero, printed non-UTF-8 bytes, or printed
 * nothing that could be parsed.
 */
public class CollectorException extends Exception {

    private final String resourceClass;
    private final Integer exitCode;

    public CollectorException(String resourceClass, String message) {
        this(resourceClass, message, null, null);
    }

    public CollectorException(String resourceClass, String message, Throwable cause) {
        this(resourceClass, message, null, cause);
    }

    public CollectorException(String resourceClass, String message, Integer exitCode, Throwable cause) {
        super("Failed to collect " + resourceClass + ": " + message, cause);
        this.resourceClass = resourceClass;
        this.exitCode = exitCode;
    }

    public String resourceClass() {
        return resourceClass;
    }

    /** Exit code of scontrol, or null if it did not get that far. */
    public Integer exitCode() {
        return exitCode;
    }
}
