package clusterwatch.model;

import clusterwatch.table.Keyed;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Configured and still-available quantity of one resource type on one node.
 */
public record NodeResource(
        @JsonProperty("node") String node,
        @JsonProperty("resource") String resource,
        @JsonProperty("available") long available,
        @JsonProperty("total") long total) implements Keyed<NodeResourceKey> {

    public NodeResource {
        Objects.requireNonNull(node, "node is required");
        Objects.requireNonNull(resource, "resource is required");
    }

    /** Derive {@code available} from the configured and allocated quantities. */
    public static NodeResource of(String node, String resource, long total, long allocated) {
        return new NodeResource(node, resource, Quantities.saturatingSubtract(total, allocated), total);
    }

    @Override
    public NodeResourceKey key() {
        return new NodeResourceKey(node, resource);
    }
}
