package clusterwatch.store;

import clusterwatch.model.ClusterDiff;
import clusterwatch.model.ClusterState;
import clusterwatch.model.Job;
import clusterwatch.model.Node;
import clusterwatch.model.Partition;

import java.util.List;
import java.util.Optional;

/**
 * Durable replica of the cluster state.
 *
 * Writes happen table by table with no transaction spanning the whole diff: a failure part
 * way through leaves earlier tables applied and later ones untouched.
 */
public interface ClusterStore {

    String LAST_UPDATED = "last_updated";

    /**
     * Upsert every added and changed row and delete every removed key, one table at a time.
     *
     * @throws StoreException naming the first table whose write failed
     */
    void applyDiff(ClusterDiff diff);

    /**
     * Rebuild the whole aggregate. Its timestamp is the newest per-row {@code updated_at},
     * or null when the store is empty.
     */
    ClusterState loadState();

    List<Node> findNodes();

    List<Partition> findPartitions();

    List<Job> findJobs();

    void putMetadata(String key, String value);

    Optional<String> getMetadata(String key);

    boolean isHealthy();
}
