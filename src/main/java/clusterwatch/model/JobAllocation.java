package clusterwatch.model;

import clusterwatch.table.Keyed;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Quantity of one resource a job consumes on one node.
 */
public record JobAllocation(
        @JsonProperty("job") long job,
        @JsonProperty("node") String node,
        @JsonProperty("resource") String resource,
        @JsonProperty("used") long used) implements Keyed<JobAllocationKey> {

    public JobAllocation {
        Objects.requireNonNull(node, "node is required");
        Objects.requireNonNull(resource, "resource is required");
    }

    @Override
    public JobAllocationKey key() {
        return new JobAllocationKey(job, node, resource);
    }
}
