package clusterwatch.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw value(s) of one key inside a record block.
 * A key seen once holds a single occurrence; a repeated key holds them all in document order.
 */
public final class FieldValue {

    private final String key;
    private final List<String> occurrences;

    FieldValue(String key, List<String> occurrences) {
        this.key = key;
        this.occurrences = List.copyOf(occurrences);
    }

    /** Wrap one piece of a larger value so element decoders can run on it. */
    public static FieldValue single(String key, String value) {
        return new FieldValue(key, List.of(value));
    }

    public String key() {
        return key;
    }

    public boolean isRepeated() {
        return occurrences.size() > 1;
    }

    /**
     * The scalar text of this field.
     *
     * @throws RecordParseException if the key occurred more than once
     */
    public String text() throws RecordParseException {
        if (isRepeated()) {
            throw new RecordParseException("Expected a single value but key is repeated", key,
                    String.join(" ", occurrences));
        }
        return occurrences.get(0);
    }

    /**
     * Sequence view: the accumulated values of a repeated key, or the comma-separated
     * pieces of a single value.
     */
    public List<String> elements() {
        if (isRepeated()) {
            return occurrences;
        }
        return splitCommas(occurrences.get(0));
    }

    /**
     * Mapping view: every comma-separated piece is split on its first {@code '='}.
     *
     * @throws RecordParseException if a piece has no {@code '='}
     */
    public Map<String, String> entries() throws RecordParseException {
        Map<String, String> result = new LinkedHashMap<>();
        for (String occurrence : occurrences) {
            for (String piece : splitCommas(occurrence)) {
                int eq = piece.indexOf('=');
                if (eq < 0) {
                    throw new RecordParseException("Invalid key-value pair", key, piece);
                }
                result.put(piece.substring(0, eq), piece.substring(eq + 1));
            }
        }
        return result;
    }

    private static List<String> splitCommas(String value) {
        List<String> pieces = new ArrayList<>();
        for (String piece : value.split(",")) {
            String trimmed = piece.trim();
            if (!trimmed.isEmpty()) {
                pieces.add(trimmed);
            }
        }
        return pieces;
    }

    @Override
    public String toString() {
        return key + "=" + String.join("|", occurrences);
    }
}
