package clusterwatch.collector;

import clusterwatch.collector.CommandRunner.CommandOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Invokes {@code scontrol show ...} once per resource class and returns its stdout as text.
 */
public class ScontrolClient {

    private static final Logger log = LoggerFactory.getLogger(ScontrolClient.class);

    public static final String NODES = "nodes";
    public static final String PARTITIONS = "partitions";
    public static final String JOBS = "jobs";

    private final String executable;
    private final CommandRunner runner;

    public ScontrolClient(String executable, CommandRunner runner) {
        this.executable = executable;
        this.runner = runner;
    }

    public String showNodes() throws CollectorException {
        return show(NODES);
    }

    public String showPartitions() throws CollectorException {
        return show(PARTITIONS);
    }

    /** {@code --details} adds the per-node allocation lines used for job allocations. */
    public String showJobs() throws CollectorException {
        return show(JOBS, "--details");
    }

    private String show(String resourceClass, String... extraArgs) throws CollectorException {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("show");
        command.add(resourceClass);
        command.addAll(List.of(extraArgs));

        CommandOutput output;
        try {
            output = runner.run(command);
        } catch (IOException e) {
            throw new CollectorException(resourceClass, "cannot run " + executable, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollectorException(resourceClass, "interrupted", e);
        }

        if (!output.isSuccess()) {
            throw new CollectorException(resourceClass,
                    "scontrol exited with code " + output.exitCode() + ": " + output.stderr(),
                    output.exitCode(), null);
        }
        if (!output.stderr().isEmpty()) {
            log.debug("scontrol show {} stderr: {}", resourceClass, output.stderr());
        }
        return decodeUtf8(resourceClass, output.stdout());
    }

    static String decodeUtf8(String resourceClass, byte[] bytes) throws CollectorException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new CollectorException(resourceClass, "output is not valid UTF-8", 0, e);
        }
    }
}
