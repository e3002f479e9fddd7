package clusterwatch.producer;

import clusterwatch.collector.ClusterCollector;
import clusterwatch.collector.CollectorException;
import clusterwatch.model.ClusterState;

/**
 * Live snapshots from scontrol.
 */
public class CollectorSnapshotSource implements SnapshotSource {

    private final ClusterCollector collector;

    public CollectorSnapshotSource(ClusterCollector collector) {
        this.collector = collector;
    }

    @Override
    public ClusterState snapshot() throws CollectorException {
        return collector.collect();
    }
}
