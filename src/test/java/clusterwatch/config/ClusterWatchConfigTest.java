package clusterwatch.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClusterWatchConfigTest {

    @Test
    void defaults() {
        ClusterWatchConfig config = ClusterWatchConfig.defaults();

        assertEquals(Duration.ofSeconds(30), config.producerInterval());
        assertEquals(3000, config.apiPort());
        assertEquals("scontrol", config.scontrolPath());
        assertEquals("clusterwatch worker", config.workerCommand());
        assertTrue(config.databaseUrl().startsWith("jdbc:h2:file:"));
    }

    @Test
    void readsEnvironment() {
        ClusterWatchConfig config = ClusterWatchConfig.fromEnv(Map.of(
                "CLUSTERWATCH_DB_URL", "jdbc:h2:mem:env",
                "CLUSTERWATCH_PORT", "8080",
                "CLUSTERWATCH_INTERVAL_SECONDS", "5",
                "CLUSTERWATCH_SCONTROL", "/usr/local/bin/scontrol",
                "CLUSTERWATCH_WORKER_CMD", "ssh hpc clusterwatch worker"));

        assertEquals("jdbc:h2:mem:env", config.databaseUrl());
        assertEquals(8080, config.apiPort());
        assertEquals(Duration.ofSeconds(5), config.producerInterval());
        assertEquals("/usr/local/bin/scontrol", config.scontrolPath());
        assertEquals("ssh hpc clusterwatch worker", config.workerCommand());
    }

    @Test
    void blankEnvironmentValuesAreIgnored() {
        ClusterWatchConfig config = ClusterWatchConfig.fromEnv(Map.of("CLUSTERWATCH_PORT", " "));

        assertEquals(3000, config.apiPort());
    }

    @Test
    void badEnvironmentNumberNamesVariable() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ClusterWatchConfig.fromEnv(Map.of("CLUSTERWATCH_PORT", "http")));

        assertTrue(e.getMessage().contains("CLUSTERWATCH_PORT"));
    }

    @Test
    void intervalMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> ClusterWatchConfig.defaults().withProducerInterval(Duration.ZERO));
    }
}
