package clusterwatch.collector;

import java.io.IOException;
import java.util.List;

/**
 * Runs an external command to completion and captures its output.
 * Tests substitute canned output for the real scontrol binary.
 */
@FunctionalInterface
public interface CommandRunner {

    CommandOutput run(List<String> command) throws IOException, InterruptedException;

    /**
     * Exit status plus the raw bytes written to stdout and the (lossily decoded) stderr text.
     */
    record CommandOutput(int exitCode, byte[] stdout, String stderr) {

        public static CommandOutput success(byte[] stdout) {
            return new CommandOutput(0, stdout, "");
        }

        public boolean isSuccess() {
            return exitCode == 0;
        }
    }
}
