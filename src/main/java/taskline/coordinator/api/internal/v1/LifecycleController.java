package taskline.coordinator.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import taskline.coordinator.api.Controller;
import taskline.coordinator.api.internal.v1.dto.EventResponse;
import taskline.coordinator.api.internal.v1.dto.TaskFailedRequest;
import taskline.coordinator.api.internal.v1.dto.TaskSucceededRequest;
import taskline.coordinator.error.StoreUnavailableException;
import taskline.coordinator.model.LifecycleEvent;
import taskline.coordinator.model.LifecycleEventType;
import taskline.coordinator.model.TransitionResult;
import taskline.coordinator.server.RouterHandler;
import taskline.coordinator.signal.LifecycleSignalBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lifecycle event intake for remote workers (internal API).
 * POST /internal/v1/tasks/{taskId}/started
 * POST /internal/v1/tasks/{taskId}/succeeded - body {"result": ...}
 * POST /internal/v1/tasks/{taskId}/failed - body {"error": ...}
 *
 * Events are applied synchronously so the worker learns the outcome; repeated
 * calls are idempotent.
 */
public class LifecycleController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(LifecycleController.class);

    private static final Pattern EVENT_PATTERN =
            Pattern.compile("^/internal/v1/tasks/([^/]+)/(started|succeeded|failed)$");

    private final LifecycleSignalBus signalBus;

    public LifecycleController(LifecycleSignalBus signalBus) {
        this.signalBus = signalBus;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && EVENT_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher matcher = EVENT_PATTERN.matcher(path);
            if (!matcher.matches()) {
                return ControllerResponse.notFound("unknown lifecycle endpoint");
            }

            String taskId = matcher.group(1);
            String body = req.content().toString(StandardCharsets.UTF_8);
            LifecycleEvent event = switch (matcher.group(2)) {
                case "started" -> LifecycleEvent.started(taskId);
                case "succeeded" -> succeeded(taskId, body);
                default -> failed(taskId, body);
            };

            TransitionResult result = signalBus.applyNow(event);
            HttpResponseStatus status = result == TransitionResult.NOT_FOUND
                    ? HttpResponseStatus.NOT_FOUND
                    : HttpResponseStatus.OK;

            return ControllerResponse.json(status,
                    RouterHandler.mapper().writeValueAsString(EventResponse.from(result)));

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid request body");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (StoreUnavailableException e) {
            log.warn("Lifecycle event rejected, store unavailable: {}", e.getMessage());
            return ControllerResponse.serviceUnavailable("store unavailable");
        } catch (Exception e) {
            log.error("Lifecycle controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private LifecycleEvent succeeded(String taskId, String body) throws JsonProcessingException {
        if (body.isBlank()) {
            return LifecycleEvent.succeeded(taskId, null);
        }
        TaskSucceededRequest request = RouterHandler.mapper().readValue(body, TaskSucceededRequest.class);
        return new LifecycleEvent(taskId, LifecycleEventType.SUCCEEDED, request.result(), null,
                request.occurredAt());
    }

    private LifecycleEvent failed(String taskId, String body) throws JsonProcessingException {
        if (body.isBlank()) {
            throw new IllegalArgumentException("error is required");
        }
        TaskFailedRequest request = RouterHandler.mapper().readValue(body, TaskFailedRequest.class);
        request.validate();
        return new LifecycleEvent(taskId, LifecycleEventType.FAILED, null, request.error(),
                request.occurredAt());
    }
}
