package clusterwatch.producer;

import clusterwatch.model.ClusterState;
import clusterwatch.model.Job;
import clusterwatch.model.JobAllocation;
import clusterwatch.model.JobAllocationKey;
import clusterwatch.model.JobResource;
import clusterwatch.model.JobResourceKey;
import clusterwatch.model.JobStatus;
import clusterwatch.model.Node;
import clusterwatch.model.NodePartition;
import clusterwatch.model.NodePartitionKey;
import clusterwatch.model.NodeResource;
import clusterwatch.model.NodeResourceKey;
import clusterwatch.model.NodeStatus;
import clusterwatch.model.Partition;
import clusterwatch.model.PartitionStatus;
import clusterwatch.table.Table;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Synthetic cluster for running without a scheduler: partitions {@code gpu} and
 * {@code standard}, nodes {@code node01..node10} and jobs {@code 1001..1005}.
 *
 * Node and job states are drawn from {@code random} on every snapshot, so successive
 * snapshots produce non-trivial diffs. A seeded {@link Random} makes the sequence repeatable.
 */
public class MockSnapshotSource implements SnapshotSource {

    private static final int NODE_COUNT = 10;
    private static final int JOB_COUNT = 5;
    private static final int NODE_CPUS = 64;
    private static final long NODE_MEMORY_MB = 256_000;
    private static final int NODE_GPUS = 4;

    private static final NodeStatus[] NODE_STATES = {
            NodeStatus.IDLE, NodeStatus.ALLOC, NodeStatus.MIX, NodeStatus.DOWN
    };
    private static final JobStatus[] JOB_STATES = {
            JobStatus.PENDING, JobStatus.RUNNING, JobStatus.COMPLETED
    };

    private final Random random;
    private final Clock clock;

    public MockSnapshotSource(Random random, Clock clock) {
        this.random = random;
        this.clock = clock;
    }

    @Override
    public ClusterState snapshot() {
        Instant now = clock.instant();

        List<Partition> partitions = List.of(
                partition("gpu", NODE_COUNT / 2, now),
                partition("standard", NODE_COUNT, now));

        List<Node> nodes = new ArrayList<>();
        List<NodeResource> nodeResources = new ArrayList<>();
        List<NodePartition> nodePartitions = new ArrayList<>();
        for (int i = 1; i <= NODE_COUNT; i++) {
            String name = nodeName(i);
            boolean gpu = i % 2 == 0;
            List<String> memberships = gpu ? List.of("standard", "gpu") : List.of("standard");

            nodes.add(Node.builder()
                    .name(name)
                    .status(NODE_STATES[random.nextInt(NODE_STATES.length)])
                    .cpus(NODE_CPUS)
                    .memory(NODE_MEMORY_MB)
                    .partitions(memberships)
                    .updatedAt(now)
                    .build());
            nodeResources.add(NodeResource.of(name, "cpu", NODE_CPUS, 0));
            for (String partition : memberships) {
                nodePartitions.add(new NodePartition(name, partition));
            }
            if (gpu) {
                nodeResources.add(NodeResource.of(name, "gpu", NODE_GPUS, 0));
            }
        }

        List<Job> jobs = new ArrayList<>();
        List<JobResource> jobResources = new ArrayList<>();
        List<JobAllocation> jobAllocations = new ArrayList<>();
        for (int i = 1; i <= JOB_COUNT; i++) {
            long jobId = 1000 + i;
            JobStatus status = JOB_STATES[random.nextInt(JOB_STATES.length)];
            boolean running = status == JobStatus.RUNNING;

            jobs.add(Job.builder()
                    .jobId(jobId)
                    .user("user" + (1 + random.nextInt(4)))
                    .partition("gpu")
                    .status(status)
                    .timeLimit("12:00:00")
                    .startTime(status == JobStatus.PENDING ? null : now)
                    .submitTime(now)
                    .updatedAt(now)
                    .build());
            jobResources.add(new JobResource(jobId, "cpu", 1 + random.nextInt(127), running ? NODE_CPUS : 0));
            if (running) {
                jobAllocations.add(new JobAllocation(jobId, nodeName(1 + random.nextInt(NODE_COUNT)), "cpu",
                        NODE_CPUS));
            }
        }

        Table<String, Partition> partitionTable = Table.of(partitions);
        Table<String, Node> nodeTable = Table.of(nodes);
        Table<Long, Job> jobTable = Table.of(jobs);
        Table<NodeResourceKey, NodeResource> nodeResourceTable = Table.of(nodeResources);
        Table<NodePartitionKey, NodePartition> nodePartitionTable = Table.of(nodePartitions);
        Table<JobResourceKey, JobResource> jobResourceTable = Table.of(jobResources);
        Table<JobAllocationKey, JobAllocation> jobAllocationTable = Table.of(jobAllocations);
        return new ClusterState(partitionTable, nodeTable, jobTable, nodeResourceTable, nodePartitionTable,
                jobResourceTable, jobAllocationTable, now);
    }

    private static Partition partition(String name, int nodeCount, Instant now) {
        return Partition.builder()
                .name(name)
                .status(PartitionStatus.UP)
                .totalCpus(nodeCount * NODE_CPUS)
                .totalMemory(nodeCount * NODE_MEMORY_MB)
                .updatedAt(now)
                .build();
    }

    private static String nodeName(int index) {
        return String.format("node%02d", index);
    }
}
