package clusterwatch.producer;

import clusterwatch.codec.ChangesetCodec;
import clusterwatch.codec.ChangesetFormatException;
import clusterwatch.collector.CollectorException;
import clusterwatch.model.ClusterDiff;
import clusterwatch.model.ClusterState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Periodically snapshots the cluster, diffs against the last emitted snapshot and writes the
 * changeset as one line.
 *
 * The first tick diffs against an empty state, so it carries the whole cluster as additions.
 * A tick whose snapshot or encoding fails emits nothing and keeps the previous snapshot as
 * the base, so the next successful tick still produces a correct diff.
 *
 * Ticks run on a single daemon thread; the last snapshot is only touched from that thread
 * (or from the caller of {@link #tick()} when the loop is not started).
 */
public class ProducerLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProducerLoop.class);

    private final SnapshotSource source;
    private final Consumer<String> sink;
    private final ScheduledExecutorService executor;
    private final CountDownLatch stopped = new CountDownLatch(1);

    private ClusterState lastState = ClusterState.empty();
    private volatile boolean running = false;

    public ProducerLoop(SnapshotSource source, Consumer<String> sink) {
        this.source = source;
        this.sink = sink;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "clusterwatch-producer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start ticking immediately and then every {@code interval} after the previous tick ends.
     */
    public void start(Duration interval) {
        if (running) {
            log.warn("Producer already running");
            return;
        }
        running = true;
        executor.scheduleWithFixedDelay(this::safeTick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Producer started, interval {}s", interval.toSeconds());
    }

    /**
     * One cycle: snapshot, diff, emit, retain.
     *
     * @return the emitted diff, or empty if the tick failed
     */
    public Optional<ClusterDiff> tick() {
        ClusterState next;
        try {
            next = source.snapshot();
        } catch (CollectorException e) {
            log.error("Snapshot failed, keeping previous state", e);
            return Optional.empty();
        }

        ClusterDiff diff = lastState.diff(next);
        String line;
        try {
            line = ChangesetCodec.encode(diff);
        } catch (ChangesetFormatException e) {
            log.error("Failed to encode diff, keeping previous state", e);
            return Optional.empty();
        }

        sink.accept(line);
        lastState = next;
        log.info("Emitted diff ({} changes): {}", diff.totalChanges(), diff.summary());
        return Optional.of(diff);
    }

    /** Snapshot the next tick will diff against. */
    public ClusterState lastState() {
        return lastState;
    }

    /**
     * Block the calling thread until {@link #stop()}.
     */
    public void awaitStop() throws InterruptedException {
        stopped.await();
    }

    public void stop() {
        if (!running) {
            executor.shutdown();
            stopped.countDown();
            return;
        }
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Producer forcefully stopped");
            } else {
                log.info("Producer stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            stopped.countDown();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    private void safeTick() {
        try {
            tick();
        } catch (Exception e) {
            log.error("Producer tick error", e);
        }
    }
}
