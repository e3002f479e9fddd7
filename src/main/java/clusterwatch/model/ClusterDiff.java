package clusterwatch.model;

import clusterwatch.table.TableDiff;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Changeset between two {@link ClusterState} snapshots: one {@link TableDiff} per table
 * plus the capture time of the newer snapshot. This is the unit sent on the wire.
 */
public record ClusterDiff(
        @JsonProperty("partitions") TableDiff<String, Partition> partitions,
        @JsonProperty("nodes") TableDiff<String, Node> nodes,
        @JsonProperty("jobs") TableDiff<Long, Job> jobs,
        @JsonProperty("node_resources") TableDiff<NodeResourceKey, NodeResource> nodeResources,
        @JsonProperty("node_partitions") TableDiff<NodePartitionKey, NodePartition> nodePartitions,
        @JsonProperty("job_resources") TableDiff<JobResourceKey, JobResource> jobResources,
        @JsonProperty("job_allocations") TableDiff<JobAllocationKey, JobAllocation> jobAllocations,
        @JsonProperty("updated_at") Instant updatedAt) {

    public ClusterDiff {
        partitions = orEmpty(partitions);
        nodes = orEmpty(nodes);
        jobs = orEmpty(jobs);
        nodeResources = orEmpty(nodeResources);
        nodePartitions = orEmpty(nodePartitions);
        jobResources = orEmpty(jobResources);
        jobAllocations = orEmpty(jobAllocations);
    }

    /** True when no table changed. An empty diff is still a valid heartbeat. */
    @JsonIgnore
    public boolean isEmpty() {
        return totalChanges() == 0;
    }

    public int totalChanges() {
        return partitions.size() + nodes.size() + jobs.size()
                + nodeResources.size() + nodePartitions.size()
                + jobResources.size() + jobAllocations.size();
    }

    /** Short per-table summary for log lines. */
    public String summary() {
        return "partitions=" + partitions +
                " nodes=" + nodes +
                " jobs=" + jobs +
                " node_resources=" + nodeResources +
                " node_partitions=" + nodePartitions +
                " job_resources=" + jobResources +
                " job_allocations=" + jobAllocations;
    }

    private static <K, V> TableDiff<K, V> orEmpty(TableDiff<K, V> diff) {
        return diff == null ? TableDiff.empty() : diff;
    }
}
