package taskline.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import taskline.coordinator.api.Controller;
import taskline.coordinator.api.v1.dto.SubmitTaskRequest;
import taskline.coordinator.api.v1.dto.SubmitTaskResponse;
import taskline.coordinator.api.v1.dto.TaskStatusResponse;
import taskline.coordinator.error.StoreUnavailableException;
import taskline.coordinator.error.SubmissionException;
import taskline.coordinator.error.TaskNotFoundException;
import taskline.coordinator.model.TaskView;
import taskline.coordinator.server.RouterHandler;
import taskline.coordinator.service.QueryService;
import taskline.coordinator.service.SubmissionGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for task submission and status polling (public API).
 *
 * POST /api/v1/tasks - Submit a task
 * GET /api/v1/tasks/{taskId} - Get status, result and queue position
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks/?$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");

    private final SubmissionGateway submissionGateway;
    private final QueryService queryService;

    public TaskController(SubmissionGateway submissionGateway, QueryService queryService) {
        this.submissionGateway = submissionGateway;
        this.queryService = queryService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return TASKS_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return TASK_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST) && TASKS_PATTERN.matcher(path).matches()) {
                return handleSubmit(req);
            }

            Matcher taskMatcher = TASK_BY_ID_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.GET) && taskMatcher.matches()) {
                return handleGetTask(taskMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown task endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid request body");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (TaskNotFoundException e) {
            return ControllerResponse.notFound("task not found");
        } catch (SubmissionException | StoreUnavailableException e) {
            log.warn("Task endpoint unavailable: {}", e.getMessage());
            return ControllerResponse.serviceUnavailable(e.getMessage());
        } catch (Exception e) {
            log.error("Task controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/tasks - Submit a task
     */
    private ControllerResponse handleSubmit(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        SubmitTaskRequest request = RouterHandler.mapper().readValue(body, SubmitTaskRequest.class);

        request.validate();

        String taskId = submissionGateway.submit(request.text());

        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(SubmitTaskResponse.dispatched(taskId)));
    }

    /**
     * GET /api/v1/tasks/{taskId} - Get task status
     */
    private ControllerResponse handleGetTask(String taskId) throws Exception {
        TaskView view = queryService.query(taskId);
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(TaskStatusResponse.from(view)));
    }
}
