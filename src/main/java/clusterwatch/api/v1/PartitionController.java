package clusterwatch.api.v1;

import clusterwatch.api.Controller;
import clusterwatch.api.RouterHandler;
import clusterwatch.model.Partition;
import clusterwatch.store.ClusterStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.util.List;
import java.util.Map;

/**
 * GET /api/v1/partitions - List all partitions
 */
public class PartitionController implements Controller {

    private final ClusterStore store;

    public PartitionController(ClusterStore store) {
        this.store = store;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/partitions".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        List<Partition> partitions = store.findPartitions();
        try {
            return ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(Map.of("partitions", partitions)));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize partitions response", e);
        }
    }
}
