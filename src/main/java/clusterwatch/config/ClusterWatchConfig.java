package clusterwatch.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;

/**
 * Configuration holder for all three commands.
 * All settings have sensible defaults.
 */
public final class ClusterWatchConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/clusterwatch;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Producer settings
    private Duration producerInterval = Duration.ofSeconds(30);
    private boolean mock = false;
    private Long mockSeed = null; // random seed per run when unset

    // Collector settings
    private String scontrolPath = "scontrol";
    private ZoneId timeZone = ZoneId.systemDefault();
    private Duration commandTimeout = Duration.ofSeconds(60);

    // Monitor settings
    private String workerCommand = "clusterwatch worker";

    // API settings
    private String apiHost = "0.0.0.0";
    private int apiPort = 3000;

    private ClusterWatchConfig() {
    }

    public static ClusterWatchConfig defaults() {
        return new ClusterWatchConfig();
    }

    public static ClusterWatchConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static ClusterWatchConfig fromEnv(Map<String, String> env) {
        ClusterWatchConfig config = new ClusterWatchConfig();

        String dbUrl = env.get("CLUSTERWATCH_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = env.get("CLUSTERWATCH_PORT");
        if (port != null && !port.isBlank()) {
            config.apiPort = parseInt("CLUSTERWATCH_PORT", port);
        }

        String interval = env.get("CLUSTERWATCH_INTERVAL_SECONDS");
        if (interval != null && !interval.isBlank()) {
            config.producerInterval = Duration.ofSeconds(parseInt("CLUSTERWATCH_INTERVAL_SECONDS", interval));
        }

        String scontrol = env.get("CLUSTERWATCH_SCONTROL");
        if (scontrol != null && !scontrol.isBlank()) {
            config.scontrolPath = scontrol;
        }

        String workerCmd = env.get("CLUSTERWATCH_WORKER_CMD");
        if (workerCmd != null && !workerCmd.isBlank()) {
            config.workerCommand = workerCmd;
        }

        return config;
    }

    static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + name + ": " + value, e);
        }
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Duration producerInterval() {
        return producerInterval;
    }

    public boolean mock() {
        return mock;
    }

    public Long mockSeed() {
        return mockSeed;
    }

    public String scontrolPath() {
        return scontrolPath;
    }

    public ZoneId timeZone() {
        return timeZone;
    }

    public Duration commandTimeout() {
        return commandTimeout;
    }

    public String workerCommand() {
        return workerCommand;
    }

    public String apiHost() {
        return apiHost;
    }

    public int apiPort() {
        return apiPort;
    }

    // Fluent setters for testing/customization
    public ClusterWatchConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public ClusterWatchConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public ClusterWatchConfig withProducerInterval(Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Producer interval must be positive: " + interval);
        }
        this.producerInterval = interval;
        return this;
    }

    public ClusterWatchConfig withMock(boolean mock) {
        this.mock = mock;
        return this;
    }

    public ClusterWatchConfig withMockSeed(Long seed) {
        this.mockSeed = seed;
        return this;
    }

    public ClusterWatchConfig withScontrolPath(String path) {
        this.scontrolPath = path;
        return this;
    }

    public ClusterWatchConfig withTimeZone(ZoneId zone) {
        this.timeZone = zone;
        return this;
    }

    public ClusterWatchConfig withCommandTimeout(Duration timeout) {
        this.commandTimeout = timeout;
        return this;
    }

    public ClusterWatchConfig withWorkerCommand(String command) {
        this.workerCommand = command;
        return this;
    }

    public ClusterWatchConfig withApiHost(String host) {
        this.apiHost = host;
        return this;
    }

    public ClusterWatchConfig withApiPort(int port) {
        this.apiPort = port;
        return this;
    }

    @Override
    public String toString() {
        return "ClusterWatchConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", interval=" + producerInterval.toSeconds() + "s" +
                ", mock=" + mock +
                ", scontrol='" + scontrolPath + '\'' +
                ", timeZone=" + timeZone +
                ", api=" + apiHost + ":" + apiPort +
                '}';
    }
}
