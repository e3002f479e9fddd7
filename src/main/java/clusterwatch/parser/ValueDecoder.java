package clusterwatch.parser;

/**
 * Strategy that coerces a raw field into the type the caller asked for.
 * The text itself carries no type tags; the decoder decides how to read it.
 *
 * @param <T> target type
 */
@FunctionalInterface
public interface ValueDecoder<T> {

    T decode(FieldValue value) throws RecordParseException;
}
