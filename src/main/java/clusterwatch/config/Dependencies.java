package clusterwatch.config;

import clusterwatch.api.ClusterApiServer;
import clusterwatch.api.RouterHandler;
import clusterwatch.api.v1.HealthController;
import clusterwatch.api.v1.JobController;
import clusterwatch.api.v1.NodeController;
import clusterwatch.api.v1.PartitionController;
import clusterwatch.api.v1.StatusController;
import clusterwatch.collector.ClusterCollector;
import clusterwatch.collector.ProcessCommandRunner;
import clusterwatch.collector.ScontrolClient;
import clusterwatch.consumer.ConsumerLoop;
import clusterwatch.producer.CollectorSnapshotSource;
import clusterwatch.producer.MockSnapshotSource;
import clusterwatch.producer.ProducerLoop;
import clusterwatch.producer.SnapshotSource;
import clusterwatch.store.ClusterStore;
import clusterwatch.store.Database;
import clusterwatch.store.JdbcClusterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Random;
import java.util.function.Consumer;

/**
 * Manual dependency injection container.
 *
 * The database is opened lazily so the worker, which never touches it, runs without one.
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(ClusterWatchConfig.fromEnv())) {
 *     deps.apiServer().start(config.apiHost(), config.apiPort());
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final ClusterWatchConfig config;
    private final Clock clock;

    // Lazy-initialized
    private Database database;
    private ClusterStore store;
    private ProducerLoop producerLoop;
    private ClusterApiServer apiServer;

    private Dependencies(ClusterWatchConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        log.info("Initializing dependencies with config: {}", config);
    }

    public static Dependencies create(ClusterWatchConfig config) {
        return new Dependencies(config, Clock.systemUTC());
    }

    public static Dependencies create() {
        return create(ClusterWatchConfig.fromEnv());
    }

    public ClusterWatchConfig config() {
        return config;
    }

    public synchronized Database database() {
        if (database == null) {
            database = new Database(config);
        }
        return database;
    }

    public synchronized ClusterStore store() {
        if (store == null) {
            store = new JdbcClusterStore(database());
        }
        return store;
    }

    /**
     * Mock or live snapshots depending on {@link ClusterWatchConfig#mock()}.
     */
    public SnapshotSource snapshotSource() {
        if (config.mock()) {
            Random random = config.mockSeed() != null ? new Random(config.mockSeed()) : new Random();
            log.info("Using mock snapshot source");
            return new MockSnapshotSource(random, clock);
        }
        ScontrolClient scontrol = new ScontrolClient(config.scontrolPath(),
                new ProcessCommandRunner(config.commandTimeout()));
        return new CollectorSnapshotSource(new ClusterCollector(scontrol, config.timeZone(), clock));
    }

    public synchronized ProducerLoop producerLoop(Consumer<String> sink) {
        if (producerLoop == null) {
            producerLoop = new ProducerLoop(snapshotSource(), sink);
        }
        return producerLoop;
    }

    public ConsumerLoop consumerLoop() {
        return new ConsumerLoop(store(), clock);
    }

    /**
     * Router with every read API controller registered.
     */
    public RouterHandler routerHandler() {
        ClusterStore s = store();
        return new RouterHandler()
                .registerController(new HealthController(s))
                .registerController(new StatusController(s))
                .registerController(new NodeController(s))
                .registerController(new PartitionController(s))
                .registerController(new JobController(s));
    }

    public synchronized ClusterApiServer apiServer() {
        if (apiServer == null) {
            apiServer = new ClusterApiServer(routerHandler());
        }
        return apiServer;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (producerLoop != null) {
            try {
                producerLoop.stop();
            } catch (RuntimeException e) {
                log.warn("Error stopping producer: {}", e.getMessage());
            }
        }

        if (apiServer != null) {
            try {
                apiServer.stop();
            } catch (RuntimeException e) {
                log.warn("Error stopping API server: {}", e.getMessage());
            }
        }

        if (database != null) {
            try {
                database.close();
            } catch (RuntimeException e) {
                log.warn("Error closing database: {}", e.getMessage());
            }
        }

        log.info("Dependencies closed");
    }
}
