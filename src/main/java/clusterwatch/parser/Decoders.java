package clusterwatch.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Stock {@link ValueDecoder} strategies for the leaf types scontrol output needs.
 */
public final class Decoders {

    private Decoders() {
    }

    public static ValueDecoder<String> string() {
        return FieldValue::text;
    }

    public static ValueDecoder<Integer> integer() {
        return value -> {
            String text = value.text();
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw new RecordParseException("Expected an integer", value.key(), text, e);
            }
        };
    }

    public static ValueDecoder<Long> longValue() {
        return value -> {
            String text = value.text();
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                throw new RecordParseException("Expected an integer", value.key(), text, e);
            }
        };
    }

    public static ValueDecoder<Double> doubleValue() {
        return value -> {
            String text = value.text();
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new RecordParseException("Expected a number", value.key(), text, e);
            }
        };
    }

    /** Accepts {@code 1}/{@code 0} and case-insensitive {@code true}/{@code false}. */
    public static ValueDecoder<Boolean> bool() {
        return value -> {
            String text = value.text();
            if ("1".equals(text) || "true".equalsIgnoreCase(text)) {
                return Boolean.TRUE;
            }
            if ("0".equals(text) || "false".equalsIgnoreCase(text)) {
                return Boolean.FALSE;
            }
            throw new RecordParseException("Expected a boolean", value.key(), text);
        };
    }

    public static ValueDecoder<ResourceQuantity> quantity() {
        return value -> {
            String text = value.text();
            try {
                return ResourceQuantity.parse(text);
            } catch (NumberFormatException e) {
                throw new RecordParseException("Invalid resource quantity", value.key(), text, e);
            }
        };
    }

    /**
     * Maps the text through {@code parser}; the function decides how to treat unknown values.
     */
    public static <E> ValueDecoder<E> mapped(Function<String, E> parser) {
        return value -> parser.apply(value.text());
    }

    /** Sequence of elements, each decoded with {@code element}. */
    public static <T> ValueDecoder<List<T>> list(ValueDecoder<T> element) {
        return value -> {
            List<T> result = new ArrayList<>();
            for (String piece : value.elements()) {
                result.add(element.decode(FieldValue.single(value.key(), piece)));
            }
            return Collections.unmodifiableList(result);
        };
    }

    public static ValueDecoder<List<String>> stringList() {
        return list(string());
    }

    /** Nested {@code k=v,k=v} mapping, values decoded with {@code valueDecoder}. */
    public static <V> ValueDecoder<Map<String, V>> map(ValueDecoder<V> valueDecoder) {
        return value -> {
            Map<String, V> result = new LinkedHashMap<>();
            for (Map.Entry<String, String> entry : value.entries().entrySet()) {
                String subKey = value.key() + "." + entry.getKey();
                result.put(entry.getKey(), valueDecoder.decode(FieldValue.single(subKey, entry.getValue())));
            }
            return Collections.unmodifiableMap(result);
        };
    }

    public static ValueDecoder<Map<String, ResourceQuantity>> quantityMap() {
        return map(quantity());
    }
}
