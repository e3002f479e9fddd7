package clusterwatch.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class IniConfigLoaderTest {

    @TempDir
    Path dir;

    private File write(String content) throws IOException {
        Path file = dir.resolve("clusterwatch.ini");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file.toFile();
    }

    @Test
    void overlaysEverySection() throws Exception {
        File file = write("""
                [database]
                url = jdbc:h2:mem:ini-test
                pool_size = 3

                [producer]
                interval_seconds = 15
                mock = true
                mock_seed = 42

                [collector]
                scontrol = /opt/slurm/bin/scontrol
                time_zone = Europe/Berlin
                timeout_seconds = 20

                [monitor]
                worker_cmd = ssh login01 clusterwatch worker

                [api]
                host = 127.0.0.1
                port = 8081
                """);

        ClusterWatchConfig config = IniConfigLoader.load(file, ClusterWatchConfig.defaults());

        assertEquals("jdbc:h2:mem:ini-test", config.databaseUrl());
        assertEquals(3, config.databasePoolSize());
        assertEquals(Duration.ofSeconds(15), config.producerInterval());
        assertTrue(config.mock());
        assertEquals(42L, config.mockSeed());
        assertEquals("/opt/slurm/bin/scontrol", config.scontrolPath());
        assertEquals(ZoneId.of("Europe/Berlin"), config.timeZone());
        assertEquals(Duration.ofSeconds(20), config.commandTimeout());
        assertEquals("ssh login01 clusterwatch worker", config.workerCommand());
        assertEquals("127.0.0.1", config.apiHost());
        assertEquals(8081, config.apiPort());
    }

    @Test
    void missingKeysKeepDefaults() throws Exception {
        File file = write("""
                [api]
                port = 9000
                """);

        ClusterWatchConfig config = IniConfigLoader.load(file, ClusterWatchConfig.defaults());

        assertEquals(9000, config.apiPort());
        assertEquals(Duration.ofSeconds(30), config.producerInterval());
        assertEquals("scontrol", config.scontrolPath());
        assertFalse(config.mock());
        assertNull(config.mockSeed());
    }

    @Test
    void invalidValuesAreRejected() throws Exception {
        assertThrows(IllegalArgumentException.class,
                () -> IniConfigLoader.load(write("[api]\nport = eighty\n"), ClusterWatchConfig.defaults()));
        assertThrows(IllegalArgumentException.class,
                () -> IniConfigLoader.load(write("[producer]\ninterval_seconds = 0\n"), ClusterWatchConfig.defaults()));
        assertThrows(IllegalArgumentException.class,
                () -> IniConfigLoader.load(write("[collector]\ntime_zone = Mars/Olympus\n"),
                        ClusterWatchConfig.defaults()));
    }

    @Test
    void missingFileIsIoError() {
        assertThrows(IOException.class,
                () -> IniConfigLoader.load(dir.resolve("absent.ini").toFile(), ClusterWatchConfig.defaults()));
    }
}
