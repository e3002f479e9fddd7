package clusterwatch.parser;

/**
 * Raised when scontrol text cannot be decoded into the requested type.
 * Carries the offending key and raw value when they are known.
 */
public class RecordParseException extends Exception {

    private final String key;
    private final String value;

    public RecordParseException(String message) {
        this(message, null, null, null);
    }

    public RecordParseException(String message, String key, String value) {
        this(message, key, value, null);
    }

    public RecordParseException(String message, String key, String value, Throwable cause) {
        super(describe(message, key, value), cause);
        this.key = key;
        this.value = value;
    }

    /** Key of the field that failed, or null for block-level failures. */
    public String key() {
        return key;
    }

    /** Raw value that failed to decode, or null. */
    public String value() {
        return value;
    }

    private static String describe(String message, String key, String value) {
        if (key == null) {
            return message;
        }
        if (value == null) {
            return message + " (key=" + key + ")";
        }
        return message + " (key=" + key + ", value='" + value + "')";
    }
}
