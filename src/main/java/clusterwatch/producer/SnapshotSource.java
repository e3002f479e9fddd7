package clusterwatch.producer;

import clusterwatch.collector.CollectorException;
import clusterwatch.model.ClusterState;

/**
 * Supplies a complete, freshly derived cluster snapshot on every call.
 */
public interface SnapshotSource {

    ClusterState snapshot() throws CollectorException;
}
