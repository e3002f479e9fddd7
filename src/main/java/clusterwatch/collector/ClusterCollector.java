package clusterwatch.collector;

import clusterwatch.collector.JobInfo.NodeDetail;
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
import clusterwatch.parser.RecordBlock;
import clusterwatch.parser.RecordMapper;
import clusterwatch.parser.RecordParseException;
import clusterwatch.parser.ResourceQuantity;
import clusterwatch.parser.SlurmRecordParser;
import clusterwatch.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a full {@link ClusterState} from scontrol.
 *
 * Every call re-derives all seven tables from scratch. A block that does not map is skipped
 * with a warning; a class whose invocation fails, or whose output yields no usable block at
 * all, fails the whole collection with a {@link CollectorException} naming that class.
 */
public class ClusterCollector {

    private static final Logger log = LoggerFactory.getLogger(ClusterCollector.class);

    /** Resources scontrol reports in megabytes on the per-node detail lines. */
    private static final long MEGA = 1_000_000L;

    private final ScontrolClient scontrol;
    private final ZoneId zone;
    private final Clock clock;

    public ClusterCollector(ScontrolClient scontrol, ZoneId zone, Clock clock) {
        this.scontrol = scontrol;
        this.zone = zone;
        this.clock = clock;
    }

    public ClusterState collect() throws CollectorException {
        Instant now = clock.instant();

        List<NodeInfo> nodeInfos = parse(ScontrolClient.NODES, scontrol.showNodes(), NodeInfo::from);
        List<PartitionInfo> partitionInfos =
                parse(ScontrolClient.PARTITIONS, scontrol.showPartitions(), PartitionInfo::from);
        List<JobInfo> jobInfos = parse(ScontrolClient.JOBS, scontrol.showJobs(), r -> JobInfo.from(r, zone));

        Table<String, Node> nodes = new Table<>();
        Table<NodeResourceKey, NodeResource> nodeResources = new Table<>();
        Table<NodePartitionKey, NodePartition> nodePartitions = new Table<>();
        mapNodes(nodeInfos, now, nodes, nodeResources, nodePartitions);

        Table<String, Partition> partitions = mapPartitions(partitionInfos, nodeInfos, now);

        Table<Long, Job> jobs = new Table<>();
        Table<JobResourceKey, JobResource> jobResources = new Table<>();
        Table<JobAllocationKey, JobAllocation> jobAllocations = new Table<>();
        mapJobs(jobInfos, now, jobs, jobResources, jobAllocations);

        ClusterState state = new ClusterState(partitions, nodes, jobs, nodeResources, nodePartitions,
                jobResources, jobAllocations, now);
        log.debug("Collected {}", state);
        return state;
    }

    static void mapNodes(List<NodeInfo> infos, Instant now,
            Table<String, Node> nodes,
            Table<NodeResourceKey, NodeResource> nodeResources,
            Table<NodePartitionKey, NodePartition> nodePartitions) {
        for (NodeInfo info : infos) {
            nodes.put(Node.builder()
                    .name(info.name())
                    .status(NodeStatus.fromScontrol(info.state()))
                    .cpus(info.cpus())
                    .cpusAlloc(info.cpuAlloc())
                    .memory(info.realMemory())
                    .memoryAlloc(info.allocMemory())
                    .partitions(info.partitions())
                    .updatedAt(now)
                    .build());

            for (String partition : info.partitions()) {
                nodePartitions.put(new NodePartition(info.name(), partition));
            }

            for (Map.Entry<String, ResourceQuantity> cfg : info.cfgTres().entrySet()) {
                ResourceQuantity allocated = info.allocTres().get(cfg.getKey());
                nodeResources.put(NodeResource.of(info.name(), cfg.getKey(), cfg.getValue().value(),
                        allocated == null ? 0 : allocated.value()));
            }
        }
    }

    /**
     * Totals are summed over the nodes that list the partition; {@code TotalCPUs} wins for the CPU total.
     */
    static Table<String, Partition> mapPartitions(List<PartitionInfo> infos, List<NodeInfo> nodeInfos,
            Instant now) {
        Table<String, Partition> partitions = new Table<>();
        for (PartitionInfo info : infos) {
            int cpus = 0;
            int cpusAlloc = 0;
            long memory = 0;
            long memoryAlloc = 0;
            for (NodeInfo node : nodeInfos) {
                if (node.partitions().contains(info.name())) {
                    cpus += node.cpus();
                    cpusAlloc += node.cpuAlloc();
                    memory += node.realMemory();
                    memoryAlloc += node.allocMemory();
                }
            }
            partitions.put(Partition.builder()
                    .name(info.name())
                    .status(PartitionStatus.fromScontrol(info.state()))
                    .totalCpus(info.totalCpus().orElse(cpus))
                    .totalCpusAlloc(cpusAlloc)
                    .totalMemory(memory)
                    .totalMemoryAlloc(memoryAlloc)
                    .updatedAt(now)
                    .build());
        }
        return partitions;
    }

    static void mapJobs(List<JobInfo> infos, Instant now,
            Table<Long, Job> jobs,
            Table<JobResourceKey, JobResource> jobResources,
            Table<JobAllocationKey, JobAllocation> jobAllocations) {
        for (JobInfo info : infos) {
            jobs.put(Job.builder()
                    .jobId(info.jobId())
                    .user(info.user())
                    .partition(info.partition())
                    .status(JobStatus.fromScontrol(info.state()))
                    .timeLimit(info.timeLimit())
                    .startTime(info.startTime())
                    .submitTime(info.submitTime())
                    .updatedAt(now)
                    .build());

            Set<String> resourceNames = new LinkedHashSet<>(info.reqTres().keySet());
            resourceNames.addAll(info.allocTres().keySet());
            for (String resource : resourceNames) {
                jobResources.put(new JobResource(info.jobId(), resource,
                        valueOf(info.reqTres().get(resource)),
                        valueOf(info.allocTres().get(resource))));
            }

            try {
                for (JobAllocation allocation : allocations(info)) {
                    jobAllocations.put(allocation);
                }
            } catch (IllegalArgumentException e) {
                log.warn("Skipping allocations of job {}: {}", info.jobId(), e.getMessage());
            }
        }
    }

    /**
     * Per-node usage from the detail lines. Without detail lines, a job on exactly one node
     * is charged its whole {@code AllocTRES} on that node.
     */
    static List<JobAllocation> allocations(JobInfo info) {
        Map<JobAllocationKey, Long> used = new LinkedHashMap<>();
        if (!info.details().isEmpty()) {
            for (NodeDetail detail : info.details()) {
                for (String node : HostList.expand(detail.nodes())) {
                    add(used, info.jobId(), node, "cpu", HostList.countIds(detail.cpuIds()));
                    add(used, info.jobId(), node, "mem", detail.memoryMb() * MEGA);
                    for (Map.Entry<String, Long> gres : parseGres(detail.gres()).entrySet()) {
                        add(used, info.jobId(), node, gres.getKey(), gres.getValue());
                    }
                }
            }
        } else if (info.nodeList() != null && !info.allocTres().isEmpty()) {
            List<String> hosts = HostList.expand(info.nodeList());
            if (hosts.size() == 1) {
                for (Map.Entry<String, ResourceQuantity> tres : info.allocTres().entrySet()) {
                    if (!"node".equals(tres.getKey()) && !"billing".equals(tres.getKey())) {
                        add(used, info.jobId(), hosts.get(0), tres.getKey(), tres.getValue().value());
                    }
                }
            }
        }

        List<JobAllocation> result = new ArrayList<>();
        for (Map.Entry<JobAllocationKey, Long> entry : used.entrySet()) {
            JobAllocationKey key = entry.getKey();
            result.add(new JobAllocation(key.job(), key.node(), key.resource(), entry.getValue()));
        }
        return result;
    }

    /**
     * {@code gpu:a100:2(IDX:0-1),mps:100} yields {@code gres/gpu=2, gres/mps=100}.
     * A spec without a trailing count means one unit.
     */
    static Map<String, Long> parseGres(String spec) {
        Map<String, Long> result = new LinkedHashMap<>();
        if (spec == null || spec.isBlank()) {
            return result;
        }
        String flat = spec.replaceAll("\\([^)]*\\)", "");
        for (String piece : flat.split(",")) {
            String item = piece.trim();
            if (item.isEmpty()) {
                continue;
            }
            if (item.startsWith("gres/")) {
                item = item.substring("gres/".length());
            }
            String[] parts = item.split(":");
            long count = 1;
            String last = parts[parts.length - 1];
            if (parts.length > 1 && !last.isEmpty() && last.chars().allMatch(Character::isDigit)) {
                count = Long.parseLong(last);
            }
            result.merge("gres/" + parts[0], count, Long::sum);
        }
        return result;
    }

    /**
     * Parse every block, skipping blocks that fail. A non-blank output in which no block parses
     * fails the class.
     */
    static <T> List<T> parse(String resourceClass, String output, RecordMapper<T> mapper)
            throws CollectorException {
        List<T> records = new ArrayList<>();
        if (isEmptyListing(output)) {
            return records;
        }
        List<String> blocks = SlurmRecordParser.splitBlocks(output);
        RecordParseException lastError = null;
        for (String text : blocks) {
            try {
                RecordBlock block = SlurmRecordParser.parseBlock(text);
                records.add(mapper.map(block));
            } catch (RecordParseException | RuntimeException e) {
                log.warn("Skipping unparseable {} record: {}", resourceClass, e.getMessage());
                lastError = e instanceof RecordParseException rpe ? rpe
                        : new RecordParseException(String.valueOf(e.getMessage()), null, null, e);
            }
        }
        if (records.isEmpty() && lastError != null) {
            throw new CollectorException(resourceClass, "no record could be parsed", lastError);
        }
        return records;
    }

    /** scontrol prints e.g. {@code No jobs in the system} instead of an empty listing. */
    private static boolean isEmptyListing(String output) {
        String trimmed = output == null ? "" : output.trim();
        return trimmed.isEmpty() || (trimmed.startsWith("No ") && trimmed.endsWith("in the system"));
    }

    private static void add(Map<JobAllocationKey, Long> used, long job, String node, String resource,
            long amount) {
        used.merge(new JobAllocationKey(job, node, resource), amount, Long::sum);
    }

    private static long valueOf(ResourceQuantity quantity) {
        return quantity == null ? 0 : quantity.value();
    }
}
