package clusterwatch.store;

import clusterwatch.config.ClusterWatchConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; connections are handed out with auto-commit off.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(ClusterWatchConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("clusterwatch-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- PARTITIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS partitions (
                            name                VARCHAR(255) PRIMARY KEY,
                            status              VARCHAR(20) NOT NULL,
                            total_cpus          INT NOT NULL,
                            total_cpus_alloc    INT NOT NULL,
                            total_cpus_idle     INT NOT NULL,
                            total_memory        BIGINT NOT NULL,
                            total_memory_alloc  BIGINT NOT NULL,
                            total_memory_free   BIGINT NOT NULL,
                            updated_at          TIMESTAMP
                        );
                    """);

            // ---------- NODES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS nodes (
                            name            VARCHAR(255) PRIMARY KEY,
                            status          VARCHAR(20) NOT NULL,
                            cpus            INT NOT NULL,
                            cpus_alloc      INT NOT NULL,
                            cpus_idle       INT NOT NULL,
                            memory          BIGINT NOT NULL,
                            memory_alloc    BIGINT NOT NULL,
                            memory_free     BIGINT NOT NULL,
                            partitions      VARCHAR(4096) NOT NULL,
                            updated_at      TIMESTAMP
                        );
                    """);

            // ---------- JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            job_id          BIGINT PRIMARY KEY,
                            user_name       VARCHAR(255) NOT NULL,
                            partition_name  VARCHAR(255) NOT NULL,
                            status          VARCHAR(20) NOT NULL,
                            time_limit      VARCHAR(64),
                            start_time      TIMESTAMP,
                            submit_time     TIMESTAMP,
                            updated_at      TIMESTAMP
                        );
                    """);

            // ---------- NODE MEMBERSHIP AND RESOURCES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS node_partitions (
                            node            VARCHAR(255) NOT NULL,
                            partition_name  VARCHAR(255) NOT NULL,
                            PRIMARY KEY (node, partition_name)
                        );
                    """);
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS node_resources (
                            node        VARCHAR(255) NOT NULL,
                            resource    VARCHAR(255) NOT NULL,
                            available   BIGINT NOT NULL,
                            total       BIGINT NOT NULL,
                            PRIMARY KEY (node, resource)
                        );
                    """);

            // ---------- JOB RESOURCES AND ALLOCATIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_resources (
                            job_id      BIGINT NOT NULL,
                            resource    VARCHAR(255) NOT NULL,
                            requested   BIGINT NOT NULL,
                            allocated   BIGINT NOT NULL,
                            PRIMARY KEY (job_id, resource)
                        );
                    """);
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_allocations (
                            job_id      BIGINT NOT NULL,
                            node        VARCHAR(255) NOT NULL,
                            resource    VARCHAR(255) NOT NULL,
                            used        BIGINT NOT NULL,
                            PRIMARY KEY (job_id, node, resource)
                        );
                    """);

            // ---------- METADATA ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS metadata (
                            meta_key    VARCHAR(255) PRIMARY KEY,
                            meta_value  VARCHAR(4096) NOT NULL
                        );
                    """);

            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_status ON jobs(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_job_allocations_node ON job_allocations(node);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StoreException("schema", "Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
