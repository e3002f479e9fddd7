package clusterwatch.parser;

/**
 * Builds a typed record out of one block.
 *
 * @param <T> record type
 */
@FunctionalInterface
public interface RecordMapper<T> {

    T map(RecordReader record) throws RecordParseException;
}
