package clusterwatch.consumer;

/**
 * One line read from a worker channel, or the end-of-stream marker of that channel.
 *
 * @param text the line without its terminator, null at end of stream
 */
public record StreamLine(Channel channel, String text) {

    public enum Channel {
        /** Changeset lines (worker stdout) */
        DATA,
        /** Free-form worker log output (worker stderr) */
        DIAGNOSTIC
    }

    public static StreamLine eof(Channel channel) {
        return new StreamLine(channel, null);
    }

    public boolean isEof() {
        return text == null;
    }
}
