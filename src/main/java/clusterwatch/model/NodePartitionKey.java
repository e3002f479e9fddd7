package clusterwatch.model;

import java.util.Objects;

/**
 * Key of {@link NodePartition}: (node name, partition name).
 */
public record NodePartitionKey(String node, String partition) {

    public NodePartitionKey {
        Objects.requireNonNull(node, "node is required");
        Objects.requireNonNull(partition, "partition is required");
    }
}
