package clusterwatch.api.v1;

import clusterwatch.api.Controller;
import clusterwatch.api.RouterHandler;
import clusterwatch.model.Job;
import clusterwatch.model.JobStatus;
import clusterwatch.store.ClusterStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * GET /api/v1/jobs - List all jobs
 * GET /api/v1/jobs?status=RUNNING - List jobs in one state
 */
public class JobController implements Controller {

    private final ClusterStore store;

    public JobController(ClusterStore store) {
        this.store = store;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/jobs".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        List<String> statusParam = query.parameters().get("status");

        List<Job> jobs = store.findJobs();
        if (statusParam != null && !statusParam.isEmpty()) {
            JobStatus status = parseStatus(statusParam.get(0));
            jobs = jobs.stream().filter(j -> j.status() == status).toList();
        }

        try {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("jobs", jobs)));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize jobs response", e);
        }
    }

    private static JobStatus parseStatus(String value) {
        try {
            return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown job status: " + value);
        }
    }
}
