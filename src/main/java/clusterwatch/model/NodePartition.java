package clusterwatch.model;

import clusterwatch.table.Keyed;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Membership edge: the node belongs to the partition. Carries no payload beyond its key.
 */
public record NodePartition(
        @JsonProperty("node") String node,
        @JsonProperty("partition") String partition) implements Keyed<NodePartitionKey> {

    public NodePartition {
        Objects.requireNonNull(node, "node is required");
        Objects.requireNonNull(partition, "partition is required");
    }

    @Override
    public NodePartitionKey key() {
        return new NodePartitionKey(node, partition);
    }
}
