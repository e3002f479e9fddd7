package clusterwatch.model;

import java.util.Objects;

/**
 * Key of {@link JobAllocation}: (job id, node name, resource type).
 */
public record JobAllocationKey(long job, String node, String resource) {

    public JobAllocationKey {
        Objects.requireNonNull(node, "node is required");
        Objects.requireNonNull(resource, "resource is required");
    }
}
