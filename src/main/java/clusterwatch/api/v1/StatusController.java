package clusterwatch.api.v1;

import clusterwatch.api.Controller;
import clusterwatch.api.RouterHandler;
import clusterwatch.model.ClusterState;
import clusterwatch.store.ClusterStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

/**
 * Whole cluster aggregate rebuilt from the store.
 * GET /api/v1/status
 *
 * {@code updated_at} is the newest per-row timestamp in the store.
 */
public class StatusController implements Controller {

    private final ClusterStore store;

    public StatusController(ClusterStore store) {
        this.store = store;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/status".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        ClusterState state = store.loadState();
        try {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(state));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize cluster state", e);
        }
    }
}
