package clusterwatch.store;

/**
 * A write to or read from the durable store failed.
 */
public class StoreException extends RuntimeException {

    private final String table;

    public StoreException(String table, String message, Throwable cause) {
        super(message, cause);
        this.table = table;
    }

    /** Table the failing statement touched. */
    public String table() {
        return table;
    }
}
