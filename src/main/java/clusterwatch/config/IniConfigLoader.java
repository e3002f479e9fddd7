package clusterwatch.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Overlays settings from an INI file onto a {@link ClusterWatchConfig}.
 * Supports sections [database], [producer], [collector], [monitor], [api]; every key is optional.
 */
public final class IniConfigLoader {

    private IniConfigLoader() {
    }

    /**
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if a value does not parse
     */
    public static ClusterWatchConfig load(File file, ClusterWatchConfig config) throws IOException {
        Ini ini = new Ini(file);

        Profile.Section database = ini.get("database");
        Profile.Section producer = ini.get("producer");
        Profile.Section collector = ini.get("collector");
        Profile.Section monitor = ini.get("monitor");
        Profile.Section api = ini.get("api");

        // DATABASE
        String url = opt(database, "url");
        if (url != null) {
            config.withDatabaseUrl(url);
        }
        String poolSize = opt(database, "pool_size");
        if (poolSize != null) {
            config.withDatabasePoolSize(ClusterWatchConfig.parseInt("database.pool_size", poolSize));
        }

        // PRODUCER
        String interval = opt(producer, "interval_seconds");
        if (interval != null) {
            config.withProducerInterval(
                    Duration.ofSeconds(ClusterWatchConfig.parseInt("producer.interval_seconds", interval)));
        }
        String mock = opt(producer, "mock");
        if (mock != null) {
            config.withMock(Boolean.parseBoolean(mock));
        }
        String seed = opt(producer, "mock_seed");
        if (seed != null) {
            try {
                config.withMockSeed(Long.parseLong(seed));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for producer.mock_seed: " + seed, e);
            }
        }

        // COLLECTOR
        String scontrol = opt(collector, "scontrol");
        if (scontrol != null) {
            config.withScontrolPath(scontrol);
        }
        String zone = opt(collector, "time_zone");
        if (zone != null) {
            try {
                config.withTimeZone(ZoneId.of(zone));
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Invalid collector.time_zone: " + zone, e);
            }
        }
        String timeout = opt(collector, "timeout_seconds");
        if (timeout != null) {
            config.withCommandTimeout(
                    Duration.ofSeconds(ClusterWatchConfig.parseInt("collector.timeout_seconds", timeout)));
        }

        // MONITOR
        String workerCmd = opt(monitor, "worker_cmd");
        if (workerCmd != null) {
            config.withWorkerCommand(workerCmd);
        }

        // API
        String host = opt(api, "host");
        if (host != null) {
            config.withApiHost(host);
        }
        String port = opt(api, "port");
        if (port != null) {
            config.withApiPort(ClusterWatchConfig.parseInt("api.port", port));
        }

        return config;
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        if (s == null) {
            return null;
        }
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
