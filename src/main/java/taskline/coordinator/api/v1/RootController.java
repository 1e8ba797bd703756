package taskline.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import taskline.coordinator.api.Controller;
import taskline.coordinator.api.v1.dto.ServiceInfoResponse;
import taskline.coordinator.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service description.
 * GET /
 */
public class RootController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(RootController.class);

    static final String VERSION = "1.0.0";

    private static final ServiceInfoResponse INFO = new ServiceInfoResponse(
            "Taskline",
            "Submits echo tasks to a worker queue and reports their status and queue position",
            VERSION,
            endpoints());

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(INFO));
        } catch (Exception e) {
            log.error("Root controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private static Map<String, String> endpoints() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("submit", "POST /api/v1/tasks");
        endpoints.put("status", "GET /api/v1/tasks/{task_id}");
        endpoints.put("health", "GET /api/v1/health");
        return endpoints;
    }
}
