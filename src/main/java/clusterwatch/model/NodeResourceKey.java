package clusterwatch.model;

import java.util.Objects;

/**
 * Key of {@link NodeResource}: (node name, resource type).
 */
public record NodeResourceKey(String node, String resource) {

    public NodeResourceKey {
        Objects.requireNonNull(node, "node is required");
        Objects.requireNonNull(resource, "resource is required");
    }
}
