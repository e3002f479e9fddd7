package clusterwatch.codec;

import clusterwatch.model.ClusterDiff;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Line-delimited JSON wire format between producer and consumer.
 *
 * One {@link ClusterDiff} encodes to exactly one line of text (no embedded newlines).
 * Thread-safe; the underlying mapper is shared.
 */
public final class ChangesetCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .registerModule(new ClusterJsonModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ChangesetCodec() {
    }

    public static String encode(ClusterDiff diff) throws ChangesetFormatException {
        try {
            return MAPPER.writeValueAsString(diff);
        } catch (JsonProcessingException e) {
            throw new ChangesetFormatException("Failed to encode changeset", e);
        }
    }

    public static ClusterDiff decode(String line) throws ChangesetFormatException {
        if (line == null || line.isBlank()) {
            throw new ChangesetFormatException("Empty changeset line", null);
        }
        try {
            ClusterDiff diff = MAPPER.readValue(line, ClusterDiff.class);
            if (diff == null) {
                throw new ChangesetFormatException("Changeset line is not a JSON object", null);
            }
            return diff;
        } catch (JsonProcessingException e) {
            throw new ChangesetFormatException("Failed to decode changeset: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Shared mapper, also used by the read API so that keys and timestamps render the same way.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
