package clusterwatch.parser;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Pull-based view of one scontrol record block.
 *
 * Values equal to {@code ""}, {@code (null)} or {@code None} are never stored, so a key
 * holding only those reads the same as a missing key.
 */
public interface RecordReader {

    /**
     * Keys present with at least one real value, in document order.
     */
    Set<String> keys();

    boolean has(String key);

    /**
     * Raw scalar text of a key.
     *
     * @throws RecordParseException if the key is repeated
     */
    Optional<String> scalar(String key) throws RecordParseException;

    /**
     * All values of a key in document order; empty if absent.
     */
    List<String> repeated(String key);

    /**
     * Decode a field that must be present.
     *
     * @throws RecordParseException if the key is absent or the value does not decode
     */
    <T> T require(String key, ValueDecoder<T> decoder) throws RecordParseException;

    /**
     * Decode a field that may be absent.
     *
     * @throws RecordParseException if the value is present but does not decode
     */
    <T> Optional<T> optional(String key, ValueDecoder<T> decoder) throws RecordParseException;
}
