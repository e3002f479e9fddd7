package clusterwatch.store;

import clusterwatch.model.ClusterDiff;
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
import clusterwatch.table.TableDiff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of ClusterStore.
 *
 * Upserts use H2's {@code MERGE INTO ... KEY (...)}. Each table of a diff is written in its
 * own transaction, in a fixed order.
 */
public class JdbcClusterStore implements ClusterStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcClusterStore.class);

    private final Database db;

    public JdbcClusterStore(Database db) {
        this.db = db;
    }

    @Override
    public void applyDiff(ClusterDiff diff) {
        applyTable("partitions", diff.partitions(),
                """
                    MERGE INTO partitions (name, status, total_cpus, total_cpus_alloc, total_cpus_idle,
                        total_memory, total_memory_alloc, total_memory_free, updated_at)
                    KEY (name) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                (ps, p) -> {
                    ps.setString(1, p.name());
                    ps.setString(2, p.status().name());
                    ps.setInt(3, p.totalCpus());
                    ps.setInt(4, p.totalCpusAlloc());
                    ps.setInt(5, p.totalCpusIdle());
                    ps.setLong(6, p.totalMemory());
                    ps.setLong(7, p.totalMemoryAlloc());
                    ps.setLong(8, p.totalMemoryFree());
                    ps.setTimestamp(9, toTimestamp(p.updatedAt()));
                },
                "DELETE FROM partitions WHERE name = ?",
                (ps, name) -> ps.setString(1, name));

        applyTable("nodes", diff.nodes(),
                """
                    MERGE INTO nodes (name, status, cpus, cpus_alloc, cpus_idle,
                        memory, memory_alloc, memory_free, partitions, updated_at)
                    KEY (name) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                (ps, n) -> {
                    ps.setString(1, n.name());
                    ps.setString(2, n.status().name());
                    ps.setInt(3, n.cpus());
                    ps.setInt(4, n.cpusAlloc());
                    ps.setInt(5, n.cpusIdle());
                    ps.setLong(6, n.memory());
                    ps.setLong(7, n.memoryAlloc());
                    ps.setLong(8, n.memoryFree());
                    ps.setString(9, String.join(",", n.partitions()));
                    ps.setTimestamp(10, toTimestamp(n.updatedAt()));
                },
                "DELETE FROM nodes WHERE name = ?",
                (ps, name) -> ps.setString(1, name));

        applyTable("jobs", diff.jobs(),
                """
                    MERGE INTO jobs (job_id, user_name, partition_name, status, time_limit,
                        start_time, submit_time, updated_at)
                    KEY (job_id) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """,
                (ps, j) -> {
                    ps.setLong(1, j.jobId());
                    ps.setString(2, j.user());
                    ps.setString(3, j.partition());
                    ps.setString(4, j.status().name());
                    ps.setString(5, j.timeLimit());
                    ps.setTimestamp(6, toTimestamp(j.startTime()));
                    ps.setTimestamp(7, toTimestamp(j.submitTime()));
                    ps.setTimestamp(8, toTimestamp(j.updatedAt()));
                },
                "DELETE FROM jobs WHERE job_id = ?",
                (ps, jobId) -> ps.setLong(1, jobId));

        applyTable("node_resources", diff.nodeResources(),
                """
                    MERGE INTO node_resources (node, resource, available, total)
                    KEY (node, resource) VALUES (?, ?, ?, ?)
                """,
                (ps, r) -> {
                    ps.setString(1, r.node());
                    ps.setString(2, r.resource());
                    ps.setLong(3, r.available());
                    ps.setLong(4, r.total());
                },
                "DELETE FROM node_resources WHERE node = ? AND resource = ?",
                (ps, key) -> {
                    ps.setString(1, key.node());
                    ps.setString(2, key.resource());
                });

        applyTable("node_partitions", diff.nodePartitions(),
                """
                    MERGE INTO node_partitions (node, partition_name)
                    KEY (node, partition_name) VALUES (?, ?)
                """,
                (ps, np) -> {
                    ps.setString(1, np.node());
                    ps.setString(2, np.partition());
                },
                "DELETE FROM node_partitions WHERE node = ? AND partition_name = ?",
                (ps, key) -> {
                    ps.setString(1, key.node());
                    ps.setString(2, key.partition());
                });

        applyTable("job_resources", diff.jobResources(),
                """
                    MERGE INTO job_resources (job_id, resource, requested, allocated)
                    KEY (job_id, resource) VALUES (?, ?, ?, ?)
                """,
                (ps, r) -> {
                    ps.setLong(1, r.job());
                    ps.setString(2, r.resource());
                    ps.setLong(3, r.requested());
                    ps.setLong(4, r.allocated());
                },
                "DELETE FROM job_resources WHERE job_id = ? AND resource = ?",
                (ps, key) -> {
                    ps.setLong(1, key.job());
                    ps.setString(2, key.resource());
                });

        applyTable("job_allocations", diff.jobAllocations(),
                """
                    MERGE INTO job_allocations (job_id, node, resource, used)
                    KEY (job_id, node, resource) VALUES (?, ?, ?, ?)
                """,
                (ps, a) -> {
                    ps.setLong(1, a.job());
                    ps.setString(2, a.node());
                    ps.setString(3, a.resource());
                    ps.setLong(4, a.used());
                },
                "DELETE FROM job_allocations WHERE job_id = ? AND node = ? AND resource = ?",
                (ps, key) -> {
                    ps.setLong(1, key.job());
                    ps.setString(2, key.node());
                    ps.setString(3, key.resource());
                });

        log.debug("Applied diff to store: {}", diff.summary());
    }

    @Override
    public ClusterState loadState() {
        List<Partition> partitions = findPartitions();
        List<Node> nodes = findNodes();
        List<Job> jobs = findJobs();

        Instant freshest = null;
        for (Partition p : partitions) {
            freshest = newest(freshest, p.updatedAt());
        }
        for (Node n : nodes) {
            freshest = newest(freshest, n.updatedAt());
        }
        for (Job j : jobs) {
            freshest = newest(freshest, j.updatedAt());
        }

        Table<String, Partition> partitionTable = Table.of(partitions);
        Table<String, Node> nodeTable = Table.of(nodes);
        Table<Long, Job> jobTable = Table.of(jobs);
        Table<NodeResourceKey, NodeResource> nodeResourceTable = Table.of(query("node_resources",
                "SELECT * FROM node_resources ORDER BY node, resource",
                rs -> new NodeResource(rs.getString("node"), rs.getString("resource"),
                        rs.getLong("available"), rs.getLong("total"))));
        Table<NodePartitionKey, NodePartition> nodePartitionTable = Table.of(query("node_partitions",
                "SELECT * FROM node_partitions ORDER BY node, partition_name",
                rs -> new NodePartition(rs.getString("node"), rs.getString("partition_name"))));
        Table<JobResourceKey, JobResource> jobResourceTable = Table.of(query("job_resources",
                "SELECT * FROM job_resources ORDER BY job_id, resource",
                rs -> new JobResource(rs.getLong("job_id"), rs.getString("resource"),
                        rs.getLong("requested"), rs.getLong("allocated"))));
        Table<JobAllocationKey, JobAllocation> jobAllocationTable = Table.of(query("job_allocations",
                "SELECT * FROM job_allocations ORDER BY job_id, node, resource",
                rs -> new JobAllocation(rs.getLong("job_id"), rs.getString("node"),
                        rs.getString("resource"), rs.getLong("used"))));

        return new ClusterState(partitionTable, nodeTable, jobTable, nodeResourceTable, nodePartitionTable,
                jobResourceTable, jobAllocationTable, freshest);
    }

    @Override
    public List<Node> findNodes() {
        return query("nodes", "SELECT * FROM nodes ORDER BY name", this::mapNode);
    }

    @Override
    public List<Partition> findPartitions() {
        return query("partitions", "SELECT * FROM partitions ORDER BY name", this::mapPartition);
    }

    @Override
    public List<Job> findJobs() {
        return query("jobs", "SELECT * FROM jobs ORDER BY job_id", this::mapJob);
    }

    @Override
    public void putMetadata(String key, String value) {
        String sql = "MERGE INTO metadata (meta_key, meta_value) KEY (meta_key) VALUES (?, ?)";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            ps.setString(2, value);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("metadata", "Failed to write metadata: " + key, e);
        }
    }

    @Override
    public Optional<String> getMetadata(String key) {
        String sql = "SELECT meta_value FROM metadata WHERE meta_key = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(rs.getString("meta_value"));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("metadata", "Failed to read metadata: " + key, e);
        }
    }

    @Override
    public boolean isHealthy() {
        return db.isHealthy();
    }

    // ==================== Helpers ====================

    @FunctionalInterface
    private interface Binder<T> {
        void bind(PreparedStatement ps, T value) throws SQLException;
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    /**
     * Upsert added and changed rows, then delete removed keys, committing once for the table.
     */
    private <K, V> void applyTable(String table, TableDiff<K, V> diff,
            String upsertSql, Binder<V> upsert,
            String deleteSql, Binder<K> delete) {
        if (diff.isEmpty()) {
            return;
        }

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ups = conn.prepareStatement(upsertSql);
                    PreparedStatement del = conn.prepareStatement(deleteSql)) {

                for (V value : diff.added()) {
                    upsert.bind(ups, value);
                    ups.addBatch();
                }
                for (V value : diff.changed()) {
                    upsert.bind(ups, value);
                    ups.addBatch();
                }
                if (!diff.added().isEmpty() || !diff.changed().isEmpty()) {
                    ups.executeBatch();
                }

                for (K key : diff.removed()) {
                    delete.bind(del, key);
                    del.addBatch();
                }
                if (!diff.removed().isEmpty()) {
                    del.executeBatch();
                }

                conn.commit();
                log.debug("Applied {} to {}", diff, table);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException(table, "Failed to apply diff to " + table, e);
        }
    }

    private <T> List<T> query(String table, String sql, RowMapper<T> mapper) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<T> result = new ArrayList<>();
            while (rs.next()) {
                result.add(mapper.map(rs));
            }
            return result;
        } catch (SQLException e) {
            throw new StoreException(table, "Failed to read " + table, e);
        }
    }

    private Node mapNode(ResultSet rs) throws SQLException {
        String partitions = rs.getString("partitions");
        return new Node(
                rs.getString("name"),
                NodeStatus.valueOf(rs.getString("status")),
                rs.getInt("cpus"),
                rs.getInt("cpus_alloc"),
                rs.getInt("cpus_idle"),
                rs.getLong("memory"),
                rs.getLong("memory_alloc"),
                rs.getLong("memory_free"),
                partitions == null || partitions.isEmpty() ? List.of() : Arrays.asList(partitions.split(",")),
                toInstant(rs.getTimestamp("updated_at")));
    }

    private Partition mapPartition(ResultSet rs) throws SQLException {
        return new Partition(
                rs.getString("name"),
                PartitionStatus.valueOf(rs.getString("status")),
                rs.getInt("total_cpus"),
                rs.getInt("total_cpus_alloc"),
                rs.getInt("total_cpus_idle"),
                rs.getLong("total_memory"),
                rs.getLong("total_memory_alloc"),
                rs.getLong("total_memory_free"),
                toInstant(rs.getTimestamp("updated_at")));
    }

    private Job mapJob(ResultSet rs) throws SQLException {
        return new Job(
                rs.getLong("job_id"),
                rs.getString("user_name"),
                rs.getString("partition_name"),
                JobStatus.valueOf(rs.getString("status")),
                rs.getString("time_limit"),
                toInstant(rs.getTimestamp("start_time")),
                toInstant(rs.getTimestamp("submit_time")),
                toInstant(rs.getTimestamp("updated_at")));
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static Instant newest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return b.isAfter(a) ? b : a;
    }
}
