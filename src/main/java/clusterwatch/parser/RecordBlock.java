package clusterwatch.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One parsed {@code Key=Value} block. Repeated keys accumulate in document order.
 */
public final class RecordBlock implements RecordReader {

    private final Map<String, List<String>> fields;

    RecordBlock(Map<String, List<String>> fields) {
        this.fields = fields;
    }

    static RecordBlock builder() {
        return new RecordBlock(new LinkedHashMap<>());
    }

    void add(String key, String value) {
        fields.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
    }

    @Override
    public Set<String> keys() {
        return Collections.unmodifiableSet(fields.keySet());
    }

    @Override
    public boolean has(String key) {
        return fields.containsKey(key);
    }

    @Override
    public Optional<String> scalar(String key) throws RecordParseException {
        List<String> values = fields.get(key);
        if (values == null) {
            return Optional.empty();
        }
        return Optional.of(new FieldValue(key, values).text());
    }

    @Override
    public List<String> repeated(String key) {
        List<String> values = fields.get(key);
        return values == null ? List.of() : Collections.unmodifiableList(values);
    }

    @Override
    public <T> T require(String key, ValueDecoder<T> decoder) throws RecordParseException {
        List<String> values = fields.get(key);
        if (values == null) {
            throw new RecordParseException("Missing required field", key, null);
        }
        return decoder.decode(new FieldValue(key, values));
    }

    @Override
    public <T> Optional<T> optional(String key, ValueDecoder<T> decoder) throws RecordParseException {
        List<String> values = fields.get(key);
        if (values == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(decoder.decode(new FieldValue(key, values)));
    }

    @Override
    public String toString() {
        return "RecordBlock" + fields;
    }
}
