package clusterwatch.consumer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({ OS.LINUX, OS.MAC })
class WorkerProcessTest {

    @Test
    void splitsCommandOnWhitespace() throws Exception {
        try (WorkerProcess worker = WorkerProcess.start("  echo   one two ")) {
            assertEquals(List.of("echo", "one", "two"), worker.command());
            assertEquals("one two\n", new String(worker.stdout().readAllBytes(), StandardCharsets.UTF_8));
            assertEquals(0, worker.waitFor(5));
        }
    }

    @Test
    void closeKillsRunningWorker() throws Exception {
        WorkerProcess worker = WorkerProcess.start("sleep 30");
        assertTrue(worker.isAlive());
        assertEquals(-1, worker.waitFor(0));

        worker.close();

        assertFalse(worker.isAlive());
    }

    @Test
    void emptyCommandIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> WorkerProcess.start(" "));
    }
}
