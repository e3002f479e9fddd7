package clusterwatch.consumer;

import clusterwatch.codec.ChangesetCodec;
import clusterwatch.codec.ChangesetFormatException;
import clusterwatch.consumer.StreamLine.Channel;
import clusterwatch.model.ClusterDiff;
import clusterwatch.model.ClusterState;
import clusterwatch.store.ClusterStore;
import clusterwatch.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Replays changesets from a worker into an in-memory aggregate and the durable store.
 *
 * Two reader threads feed one queue, so lines from the data and diagnostic channels are
 * handled in arrival order while each channel keeps its own order. Diffs are applied one at
 * a time on the calling thread. The loop ends when the data channel reaches end of stream.
 */
public class ConsumerLoop {

    private static final Logger log = LoggerFactory.getLogger(ConsumerLoop.class);

    private final ClusterStore store;
    private final Clock clock;
    private final ClusterState state = ClusterState.empty();

    private long applied;
    private long skipped;
    private long storeFailures;

    public ConsumerLoop(ClusterStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Consume both channels until the data channel closes.
     */
    public void run(InputStream data, InputStream diagnostic) throws InterruptedException {
        BlockingQueue<StreamLine> queue = new LinkedBlockingQueue<>();
        startReader(Channel.DATA, data, queue);
        startReader(Channel.DIAGNOSTIC, diagnostic, queue);

        while (true) {
            StreamLine line = queue.take();
            if (line.channel() == Channel.DIAGNOSTIC) {
                if (line.isEof()) {
                    log.debug("Worker diagnostic channel closed");
                } else {
                    log.info("[worker] {}", line.text());
                }
                continue;
            }
            if (line.isEof()) {
                log.info("Worker data channel closed: applied={} skipped={} storeFailures={}",
                        applied, skipped, storeFailures);
                return;
            }
            handleLine(line.text());
        }
    }

    /**
     * Decode and apply one changeset line. Never throws: bad lines are skipped and store
     * failures are logged, leaving the in-memory state ahead of the store.
     */
    public void handleLine(String text) {
        if (text.isBlank()) {
            return;
        }
        ClusterDiff diff;
        try {
            diff = ChangesetCodec.decode(text);
        } catch (ChangesetFormatException e) {
            skipped++;
            log.warn("Skipping malformed changeset line: {}", e.getMessage());
            log.debug("Malformed line: {}", text);
            return;
        }

        state.apply(diff);
        applied++;
        log.info("Applied diff ({} changes), state now {}", diff.totalChanges(), state);

        try {
            store.applyDiff(diff);
            Instant updatedAt = diff.updatedAt() != null ? diff.updatedAt() : clock.instant();
            store.putMetadata(ClusterStore.LAST_UPDATED, updatedAt.toString());
        } catch (StoreException e) {
            storeFailures++;
            log.error("Store write failed on table {}", e.table(), e);
        }
    }

    /** In-memory view built from every decoded diff. */
    public ClusterState state() {
        return state;
    }

    public long appliedCount() {
        return applied;
    }

    public long skippedCount() {
        return skipped;
    }

    public long storeFailureCount() {
        return storeFailures;
    }

    private static void startReader(Channel channel, InputStream stream, BlockingQueue<StreamLine> queue) {
        Thread reader = new Thread(() -> {
            try (BufferedReader in = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = in.readLine()) != null) {
                    queue.add(new StreamLine(channel, line));
                }
            } catch (IOException e) {
                log.error("Read error on {} channel", channel, e);
            } finally {
                queue.add(StreamLine.eof(channel));
            }
        }, "clusterwatch-" + channel.name().toLowerCase() + "-reader");
        reader.setDaemon(true);
        reader.start();
    }
}
