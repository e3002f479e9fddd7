package clusterwatch.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * Both pipes are drained on their own threads so a chatty stderr cannot block the child.
 * A command still running after the timeout is killed and reported as an {@link IOException}.
 */
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    private final Duration timeout;

    public ProcessCommandRunner(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public CommandOutput run(List<String> command) throws IOException, InterruptedException {
        log.debug("Running {}", command);
        Process process = new ProcessBuilder(command).start();
        process.getOutputStream().close();

        CompletableFuture<byte[]> stdout = drain(process.getInputStream());
        CompletableFuture<byte[]> stderr = drain(process.getErrorStream());

        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            throw new IOException("Command timed out after " + timeout.toSeconds() + "s: " + command);
        }

        try {
            return new CommandOutput(
                    process.exitValue(),
                    stdout.get(),
                    new String(stderr.get(), StandardCharsets.UTF_8).trim());
        } catch (ExecutionException e) {
            throw new IOException("Failed to read output of " + command, e.getCause());
        }
    }

    private static CompletableFuture<byte[]> drain(InputStream stream) {
        CompletableFuture<byte[]> result = new CompletableFuture<>();
        Thread reader = new Thread(() -> {
            try (stream) {
                result.complete(stream.readAllBytes());
            } catch (IOException e) {
                result.completeExceptionally(e);
            }
        }, "command-output-reader");
        reader.setDaemon(true);
        reader.start();
        return result;
    }
}
