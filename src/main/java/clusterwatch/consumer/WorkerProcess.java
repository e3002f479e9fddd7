package clusterwatch.consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Locally launched worker whose stdout carries changesets and whose stderr carries its logs.
 */
public final class WorkerProcess implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerProcess.class);

    private final Process process;
    private final List<String> command;

    private WorkerProcess(Process process, List<String> command) {
        this.process = process;
        this.command = command;
    }

    /**
     * Start {@code command}, split on whitespace (no shell quoting).
     */
    public static WorkerProcess start(String command) throws IOException {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("Worker command is empty");
        }
        List<String> argv = List.of(command.trim().split("\\s+"));
        Process process = new ProcessBuilder(argv).start();
        process.getOutputStream().close();
        log.info("Started worker pid={}: {}", process.pid(), argv);
        return new WorkerProcess(process, argv);
    }

    public InputStream stdout() {
        return process.getInputStream();
    }

    public InputStream stderr() {
        return process.getErrorStream();
    }

    public List<String> command() {
        return command;
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    /**
     * Wait up to {@code seconds} for the worker to exit.
     *
     * @return the exit code, or -1 if it is still running
     */
    public int waitFor(long seconds) throws InterruptedException {
        if (process.waitFor(seconds, TimeUnit.SECONDS)) {
            return process.exitValue();
        }
        return -1;
    }

    @Override
    public void close() {
        if (process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                    log.warn("Worker forcefully killed");
                }
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
            }
        }
    }
}
