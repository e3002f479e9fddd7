package clusterwatch.api.v1;

import clusterwatch.api.Controller;
import clusterwatch.api.RouterHandler;
import clusterwatch.model.Node;
import clusterwatch.store.ClusterStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.util.List;
import java.util.Map;

/**
 * GET /api/v1/nodes - List all nodes
 */
public class NodeController implements Controller {

    private final ClusterStore store;

    public NodeController(ClusterStore store) {
        this.store = store;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/nodes".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        List<Node> nodes = store.findNodes();
        try {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("nodes", nodes)));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize nodes response", e);
        }
    }
}
