package clusterwatch.model;

import clusterwatch.table.Table;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Whole-cluster snapshot: seven keyed tables plus the instant the producer captured it.
 *
 * {@code updatedAt} is a single logical snapshot time, not the maximum of per-row timestamps.
 * Mutable only through {@link #apply(ClusterDiff)}; owned by one loop at a time.
 */
public final class ClusterState {

    private final Table<String, Partition> partitions;
    private final Table<String, Node> nodes;
    private final Table<Long, Job> jobs;
    private final Table<NodeResourceKey, NodeResource> nodeResources;
    private final Table<NodePartitionKey, NodePartition> nodePartitions;
    private final Table<JobResourceKey, JobResource> jobResources;
    private final Table<JobAllocationKey, JobAllocation> jobAllocations;
    private Instant updatedAt;

    public ClusterState(
            Table<String, Partition> partitions,
            Table<String, Node> nodes,
            Table<Long, Job> jobs,
            Table<NodeResourceKey, NodeResource> nodeResources,
            Table<NodePartitionKey, NodePartition> nodePartitions,
            Table<JobResourceKey, JobResource> jobResources,
            Table<JobAllocationKey, JobAllocation> jobAllocations,
            Instant updatedAt) {
        this.partitions = Objects.requireNonNull(partitions, "partitions");
        this.nodes = Objects.requireNonNull(nodes, "nodes");
        this.jobs = Objects.requireNonNull(jobs, "jobs");
        this.nodeResources = Objects.requireNonNull(nodeResources, "nodeResources");
        this.nodePartitions = Objects.requireNonNull(nodePartitions, "nodePartitions");
        this.jobResources = Objects.requireNonNull(jobResources, "jobResources");
        this.jobAllocations = Objects.requireNonNull(jobAllocations, "jobAllocations");
        this.updatedAt = updatedAt;
    }

    /** Snapshot with no rows and no capture time, the base of the first diff. */
    public static ClusterState empty() {
        return new ClusterState(new Table<>(), new Table<>(), new Table<>(), new Table<>(),
                new Table<>(), new Table<>(), new Table<>(), null);
    }

    @JsonProperty("partitions")
    public Table<String, Partition> partitions() {
        return partitions;
    }

    @JsonProperty("nodes")
    public Table<String, Node> nodes() {
        return nodes;
    }

    @JsonProperty("jobs")
    public Table<Long, Job> jobs() {
        return jobs;
    }

    @JsonProperty("node_resources")
    public Table<NodeResourceKey, NodeResource> nodeResources() {
        return nodeResources;
    }

    @JsonProperty("node_partitions")
    public Table<NodePartitionKey, NodePartition> nodePartitions() {
        return nodePartitions;
    }

    @JsonProperty("job_resources")
    public Table<JobResourceKey, JobResource> jobResources() {
        return jobResources;
    }

    @JsonProperty("job_allocations")
    public Table<JobAllocationKey, JobAllocation> jobAllocations() {
        return jobAllocations;
    }

    @JsonProperty("updated_at")
    public Instant updatedAt() {
        return updatedAt;
    }

    /**
     * Changeset that turns this snapshot into {@code next}; carries {@code next}'s capture time.
     */
    public ClusterDiff diff(ClusterState next) {
        return new ClusterDiff(
                partitions.diff(next.partitions),
                nodes.diff(next.nodes),
                jobs.diff(next.jobs),
                nodeResources.diff(next.nodeResources),
                nodePartitions.diff(next.nodePartitions),
                jobResources.diff(next.jobResources),
                jobAllocations.diff(next.jobAllocations),
                next.updatedAt);
    }

    /**
     * Apply every table diff, then take the diff's capture time unconditionally, even if older.
     */
    public void apply(ClusterDiff diff) {
        partitions.apply(diff.partitions());
        nodes.apply(diff.nodes());
        jobs.apply(diff.jobs());
        nodeResources.apply(diff.nodeResources());
        nodePartitions.apply(diff.nodePartitions());
        jobResources.apply(diff.jobResources());
        jobAllocations.apply(diff.jobAllocations());
        updatedAt = diff.updatedAt();
    }

    public ClusterState copy() {
        return new ClusterState(partitions.copy(), nodes.copy(), jobs.copy(), nodeResources.copy(),
                nodePartitions.copy(), jobResources.copy(), jobAllocations.copy(), updatedAt);
    }

    /** Total rows across all tables. */
    public int rowCount() {
        return partitions.size() + nodes.size() + jobs.size() + nodeResources.size()
                + nodePartitions.size() + jobResources.size() + jobAllocations.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ClusterState that))
            return false;
        return partitions.equals(that.partitions)
                && nodes.equals(that.nodes)
                && jobs.equals(that.jobs)
                && nodeResources.equals(that.nodeResources)
                && nodePartitions.equals(that.nodePartitions)
                && jobResources.equals(that.jobResources)
                && jobAllocations.equals(that.jobAllocations)
                && Objects.equals(updatedAt, that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(partitions, nodes, jobs, nodeResources, nodePartitions, jobResources,
                jobAllocations, updatedAt);
    }

    @Override
    public String toString() {
        return "ClusterState{partitions=" + partitions.size() +
                ", nodes=" + nodes.size() +
                ", jobs=" + jobs.size() +
                ", nodeResources=" + nodeResources.size() +
                ", nodePartitions=" + nodePartitions.size() +
                ", jobResources=" + jobResources.size() +
                ", jobAllocations=" + jobAllocations.size() +
                ", updatedAt=" + updatedAt + '}';
    }
}
