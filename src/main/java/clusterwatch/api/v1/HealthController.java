package clusterwatch.api.v1;

import clusterwatch.api.Controller;
import clusterwatch.api.RouterHandler;
import clusterwatch.api.v1.dto.HealthResponse;
import clusterwatch.store.ClusterStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final ClusterStore store;

    public HealthController(ClusterStore store) {
        this.store = store;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        HealthResponse response;
        HttpResponseStatus status = HttpResponseStatus.OK;
        try {
            if (store.isHealthy()) {
                String lastUpdated = store.getMetadata(ClusterStore.LAST_UPDATED).orElse(null);
                response = HealthResponse.healthy(formatUptime(), VERSION, lastUpdated);
            } else {
                response = HealthResponse.unhealthy("connection failed");
                status = HttpResponseStatus.SERVICE_UNAVAILABLE;
            }
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            response = HealthResponse.unhealthy(e.getMessage());
            status = HttpResponseStatus.SERVICE_UNAVAILABLE;
        }

        try {
            return ControllerResponse.json(status, RouterHandler.mapper().writeValueAsString(response));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize health response", e);
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
