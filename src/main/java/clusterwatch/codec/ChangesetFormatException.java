package clusterwatch.codec;

/**
 * A changeset line could not be encoded or decoded.
 */
public class ChangesetFormatException extends Exception {

    public ChangesetFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
