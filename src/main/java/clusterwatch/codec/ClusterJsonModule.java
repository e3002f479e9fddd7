package clusterwatch.codec;

import clusterwatch.model.JobAllocationKey;
import clusterwatch.model.JobResourceKey;
import clusterwatch.model.NodePartitionKey;
import clusterwatch.model.NodeResourceKey;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.io.IOException;

/**
 * Composite keys travel as ordered JSON arrays of their components, e.g.
 * {@code ["node01","gres/gpu"]} or {@code [1001,"node01","cpu"]}.
 */
public class ClusterJsonModule extends SimpleModule {

    public ClusterJsonModule() {
        super("clusterwatch-keys");

        addSerializer(NodeResourceKey.class, new JsonSerializer<>() {
            @Override
            public void serialize(NodeResourceKey key, JsonGenerator gen, SerializerProvider provider)
                    throws IOException {
                gen.writeStartArray();
                gen.writeString(key.node());
                gen.writeString(key.resource());
                gen.writeEndArray();
            }
        });
        addDeserializer(NodeResourceKey.class, new JsonDeserializer<>() {
            @Override
            public NodeResourceKey deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
                JsonNode tuple = readTuple(p, ctx, NodeResourceKey.class, 2);
                return new NodeResourceKey(tuple.get(0).asText(), tuple.get(1).asText());
            }
        });

        addSerializer(NodePartitionKey.class, new JsonSerializer<>() {
            @Override
            public void serialize(NodePartitionKey key, JsonGenerator gen, SerializerProvider provider)
                    throws IOException {
                gen.writeStartArray();
                gen.writeString(key.node());
                gen.writeString(key.partition());
                gen.writeEndArray();
            }
        });
        addDeserializer(NodePartitionKey.class, new JsonDeserializer<>() {
            @Override
            public NodePartitionKey deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
                JsonNode tuple = readTuple(p, ctx, NodePartitionKey.class, 2);
                return new NodePartitionKey(tuple.get(0).asText(), tuple.get(1).asText());
            }
        });

        addSerializer(JobResourceKey.class, new JsonSerializer<>() {
            @Override
            public void serialize(JobResourceKey key, JsonGenerator gen, SerializerProvider provider)
                    throws IOException {
                gen.writeStartArray();
                gen.writeNumber(key.job());
                gen.writeString(key.resource());
                gen.writeEndArray();
            }
        });
        addDeserializer(JobResourceKey.class, new JsonDeserializer<>() {
            @Override
            public JobResourceKey deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
                JsonNode tuple = readTuple(p, ctx, JobResourceKey.class, 2);
                return new JobResourceKey(jobId(p, ctx, tuple.get(0)), tuple.get(1).asText());
            }
        });

        addSerializer(JobAllocationKey.class, new JsonSerializer<>() {
            @Override
            public void serialize(JobAllocationKey key, JsonGenerator gen, SerializerProvider provider)
                    throws IOException {
                gen.writeStartArray();
                gen.writeNumber(key.job());
                gen.writeString(key.node());
                gen.writeString(key.resource());
                gen.writeEndArray();
            }
        });
        addDeserializer(JobAllocationKey.class, new JsonDeserializer<>() {
            @Override
            public JobAllocationKey deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
                JsonNode tuple = readTuple(p, ctx, JobAllocationKey.class, 3);
                return new JobAllocationKey(jobId(p, ctx, tuple.get(0)), tuple.get(1).asText(),
                        tuple.get(2).asText());
            }
        });
    }

    private static JsonNode readTuple(JsonParser p, DeserializationContext ctx, Class<?> type, int arity)
            throws IOException {
        JsonNode node = p.readValueAsTree();
        if (node == null || !node.isArray() || node.size() != arity) {
            return (JsonNode) ctx.handleUnexpectedToken(type, p);
        }
        return node;
    }

    private static long jobId(JsonParser p, DeserializationContext ctx, JsonNode node) throws IOException {
        if (node.canConvertToLong()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText());
            } catch (NumberFormatException e) {
                throw ctx.weirdStringException(node.asText(), Long.class, "job id is not numeric");
            }
        }
        throw ctx.weirdStringException(node.toString(), Long.class, "job id is not numeric");
    }
}
