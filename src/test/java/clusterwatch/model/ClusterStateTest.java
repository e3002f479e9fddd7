package clusterwatch.model;

import clusterwatch.table.Table;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClusterStateTest {

    private static final Instant T1 = Instant.parse("2026-01-31T12:00:00Z");
    private static final Instant T2 = Instant.parse("2026-01-31T12:00:30Z");

    static Node node(String name, NodeStatus status, int cpus, int alloc, Instant at) {
        return Node.builder()
                .name(name)
                .status(status)
                .cpus(cpus)
                .cpusAlloc(alloc)
                .memory(256_000)
                .memoryAlloc(alloc * 1000L)
                .partitions(List.of("standard"))
                .updatedAt(at)
                .build();
    }

    static ClusterState state(Instant at, List<Node> nodes, List<Job> jobs, List<JobAllocation> allocations) {
        return new ClusterState(
                Table.of(List.of(Partition.builder().name("standard").status(PartitionStatus.UP)
                        .totalCpus(128).updatedAt(at).build())),
                Table.of(nodes),
                Table.of(jobs),
                Table.of(nodes.stream().map(n -> NodeResource.of(n.name(), "cpu", n.cpus(), n.cpusAlloc())).toList()),
                Table.of(nodes.stream().map(n -> new NodePartition(n.name(), "standard")).toList()),
                Table.of(jobs.stream().map(j -> new JobResource(j.jobId(), "cpu", 4, 4)).toList()),
                Table.of(allocations),
                at);
    }

    static Job job(long id, JobStatus status, Instant at) {
        return Job.builder()
                .jobId(id)
                .user("alice")
                .partition("standard")
                .status(status)
                .timeLimit("01:00:00")
                .submitTime(at)
                .updatedAt(at)
                .build();
    }

    @Test
    void nodeChangeAndAdditionScenario() {
        ClusterState s1 = state(T1, List.of(node("n1", NodeStatus.IDLE, 64, 0, T1)), List.of(), List.of());
        ClusterState s2 = state(T2, List.of(
                node("n1", NodeStatus.ALLOC, 64, 64, T2),
                node("n2", NodeStatus.IDLE, 64, 0, T2)), List.of(), List.of());

        ClusterDiff diff = s1.diff(s2);

        assertEquals(1, diff.nodes().changed().size());
        Node changed = diff.nodes().changed().get(0);
        assertEquals("n1", changed.name());
        assertEquals(NodeStatus.ALLOC, changed.status());
        assertEquals(0, changed.cpusIdle());
        assertEquals(List.of("n2"), diff.nodes().added().stream().map(Node::name).toList());
        assertTrue(diff.nodes().removed().isEmpty());

        ClusterState consumer = s1.copy();
        consumer.apply(diff);
        assertEquals(s2.nodes(), consumer.nodes());
    }

    @Test
    void applyingDiffReproducesNextSnapshot() {
        ClusterState s1 = state(T1,
                List.of(node("n1", NodeStatus.IDLE, 64, 0, T1), node("n2", NodeStatus.MIX, 64, 8, T1)),
                List.of(job(1, JobStatus.PENDING, T1), job(2, JobStatus.RUNNING, T1)),
                List.of(new JobAllocation(2, "n2", "cpu", 8)));
        ClusterState s2 = state(T2,
                List.of(node("n2", NodeStatus.ALLOC, 64, 72, T2), node("n3", NodeStatus.IDLE, 32, 0, T2)),
                List.of(job(1, JobStatus.RUNNING, T2), job(3, JobStatus.PENDING, T2)),
                List.of(new JobAllocation(1, "n2", "cpu", 64)));

        ClusterState replica = s1.copy();
        replica.apply(s1.diff(s2));

        assertEquals(s2, replica);
    }

    @Test
    void firstDiffFromEmptyAddsEverything() {
        ClusterState s1 = state(T1, List.of(node("n1", NodeStatus.IDLE, 64, 0, T1)),
                List.of(job(1, JobStatus.PENDING, T1)), List.of());

        ClusterDiff diff = ClusterState.empty().diff(s1);

        assertEquals(s1.rowCount(), diff.totalChanges());
        assertEquals(T1, diff.updatedAt());
    }

    @Test
    void diffOfIdenticalSnapshotsIsEmptyHeartbeat() {
        ClusterState s1 = state(T1, List.of(node("n1", NodeStatus.IDLE, 64, 0, T1)), List.of(), List.of());

        ClusterDiff diff = s1.diff(s1.copy());

        assertTrue(diff.isEmpty());
        assertEquals(T1, diff.updatedAt());
    }

    @Test
    void applyTwiceIsSameAsOnce() {
        ClusterState s1 = state(T1, List.of(node("n1", NodeStatus.IDLE, 64, 0, T1)), List.of(), List.of());
        ClusterState s2 = state(T2, List.of(node("n2", NodeStatus.DOWN, 64, 0, T2)),
                List.of(job(9, JobStatus.FAILED, T2)), List.of());
        ClusterDiff diff = s1.diff(s2);

        ClusterState once = s1.copy();
        once.apply(diff);
        ClusterState twice = s1.copy();
        twice.apply(diff);
        twice.apply(diff);

        assertEquals(once, twice);
    }

    @Test
    void applyTakesDiffTimestampEvenIfOlder() {
        ClusterState s2 = state(T2, List.of(), List.of(), List.of());
        ClusterDiff stale = new ClusterDiff(null, null, null, null, null, null, null, T1);

        s2.apply(stale);

        assertEquals(T1, s2.updatedAt());
    }

    @Test
    void derivedQuantitiesSaturateAtZero() {
        Node overcommitted = node("n1", NodeStatus.ALLOC, 10, 15, T1);

        assertEquals(0, overcommitted.cpusIdle());
        assertEquals(0, NodeResource.of("n1", "cpu", 10, 15).available());
        assertEquals(10, NodeResource.of("n1", "cpu", 10, 0).available());
        assertEquals(0, Quantities.saturatingSubtract(10L, 15L));
        assertEquals(0, Partition.builder().name("p").totalCpus(4).totalCpusAlloc(9).build().totalCpusIdle());
    }

    @Test
    void unknownStatesDegradeToUnknown() {
        assertEquals(NodeStatus.UNKNOWN, NodeStatus.fromScontrol("FUTURE_STATE"));
        assertEquals(NodeStatus.IDLE, NodeStatus.fromScontrol("IDLE+DRAIN"));
        assertEquals(NodeStatus.DOWN, NodeStatus.fromScontrol("DOWN*"));
        assertEquals(NodeStatus.MIX, NodeStatus.fromScontrol("mixed"));
        assertEquals(JobStatus.UNKNOWN, JobStatus.fromScontrol("TIMEOUT"));
        assertEquals(JobStatus.CANCELLED, JobStatus.fromScontrol("CANCELLED"));
        assertEquals(PartitionStatus.DOWN, PartitionStatus.fromScontrol("DRAIN"));
        assertEquals(PartitionStatus.UNKNOWN, PartitionStatus.fromScontrol(null));
    }
}
