package clusterwatch;

import clusterwatch.config.ClusterWatchConfig;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    private static CommandLine parse(String... args) throws Exception {
        return new DefaultParser().parse(App.options(), args);
    }

    @Test
    void helpExitsCleanly() {
        assertEquals(App.EXIT_OK, App.run(new String[] { "--help" }));
    }

    @Test
    void usageErrors() {
        assertEquals(App.EXIT_USAGE, App.run(new String[] {}));
        assertEquals(App.EXIT_USAGE, App.run(new String[] { "worker", "monitor" }));
        assertEquals(App.EXIT_USAGE, App.run(new String[] { "--no-such-flag", "worker" }));
        assertEquals(App.EXIT_USAGE, App.run(new String[] { "worker", "--interval", "0" }));
        assertEquals(App.EXIT_USAGE, App.run(new String[] { "api", "--port", "http" }));
        assertEquals(App.EXIT_USAGE, App.run(new String[] { "dance" }));
    }

    @Test
    void flagsOverrideDefaults() throws Exception {
        ClusterWatchConfig config = App.configure(parse(
                "worker", "--mock", "-i", "5", "--db-url", "jdbc:h2:mem:flags", "-p", "8088",
                "-w", "ssh hpc clusterwatch worker"));

        assertTrue(config.mock());
        assertEquals(Duration.ofSeconds(5), config.producerInterval());
        assertEquals("jdbc:h2:mem:flags", config.databaseUrl());
        assertEquals(8088, config.apiPort());
        assertEquals("ssh hpc clusterwatch worker", config.workerCommand());
    }

    @Test
    void missingConfigFileIsUsageError() {
        assertEquals(App.EXIT_USAGE, App.run(new String[] { "api", "-c", "/nonexistent/clusterwatch.ini" }));
    }
}
