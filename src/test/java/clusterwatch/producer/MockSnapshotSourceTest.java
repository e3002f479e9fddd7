package clusterwatch.producer;

import clusterwatch.model.ClusterState;
import clusterwatch.model.Job;
import clusterwatch.model.JobStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class MockSnapshotSourceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-01T09:00:00Z"), ZoneOffset.UTC);

    @Test
    void sameSeedSameSnapshots() {
        MockSnapshotSource a = new MockSnapshotSource(new Random(42), CLOCK);
        MockSnapshotSource b = new MockSnapshotSource(new Random(42), CLOCK);

        assertEquals(a.snapshot(), b.snapshot());
        assertEquals(a.snapshot(), b.snapshot());
    }

    @Test
    void snapshotHasFixedShape() {
        ClusterState state = new MockSnapshotSource(new Random(1), CLOCK).snapshot();

        assertEquals(2, state.partitions().size());
        assertEquals(320, state.partitions().get("gpu").orElseThrow().totalCpus());
        assertEquals(10, state.nodes().size());
        assertTrue(state.nodes().contains("node01"));
        assertTrue(state.nodes().contains("node10"));
        assertEquals(15, state.nodePartitions().size());
        assertEquals(15, state.nodeResources().size());
        assertEquals(5, state.jobs().size());
        assertEquals(5, state.jobResources().size());
        assertEquals(CLOCK.instant(), state.updatedAt());
    }

    @Test
    void onlyRunningJobsHaveAllocations() {
        ClusterState state = new MockSnapshotSource(new Random(5), CLOCK).snapshot();

        long running = state.jobs().values().stream().filter(j -> j.status() == JobStatus.RUNNING).count();
        assertEquals(running, state.jobAllocations().size());
        for (Job job : state.jobs().values()) {
            assertEquals(job.status() == JobStatus.PENDING, job.startTime() == null);
        }
    }
}
