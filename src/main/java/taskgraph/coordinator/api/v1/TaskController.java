package taskgraph.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import taskgraph.coordinator.api.Controller;
import taskgraph.coordinator.api.v1.dto.ScheduleTaskRequest;
import taskgraph.coordinator.api.v1.dto.ScheduleTaskResponse;
import taskgraph.coordinator.api.v1.dto.TaskResponse;
import taskgraph.coordinator.error.DuplicateTaskException;
import taskgraph.coordinator.error.OrderingViolationException;
import taskgraph.coordinator.error.UnknownTaskException;
import taskgraph.coordinator.model.Task;
import taskgraph.coordinator.scheduler.Orchestrator;
import taskgraph.coordinator.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for task scheduling (public API).
 *
 * POST /api/v1/tasks - Schedule a task
 * GET /api/v1/tasks - List scheduled tasks
 * GET /api/v1/tasks/{name} - Get one task
 * DELETE /api/v1/tasks/{name} - Cancel a task (?cascade=true also cancels its dependents)
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern TASK_BY_NAME_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");

    private final Orchestrator orchestrator;

    public TaskController(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (TASKS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET);
        }
        if (TASK_BY_NAME_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.DELETE);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (TASKS_PATTERN.matcher(path).matches()) {
                return req.method().equals(HttpMethod.POST) ? handleSchedule(req) : handleList();
            }

            Matcher taskMatcher = TASK_BY_NAME_PATTERN.matcher(path);
            if (taskMatcher.matches()) {
                String name = URLDecoder.decode(taskMatcher.group(1), StandardCharsets.UTF_8);
                if (req.method().equals(HttpMethod.DELETE)) {
                    return handleCancel(name, isCascade(req));
                }
                return handleGet(name);
            }

            return ControllerResponse.notFound("unknown task endpoint");

        } catch (DuplicateTaskException e) {
            return ControllerResponse.conflict(e.getMessage());
        } catch (OrderingViolationException e) {
            return ControllerResponse.unprocessable(e.getMessage());
        } catch (UnknownTaskException e) {
            return ControllerResponse.notFound(e.getMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (IllegalStateException e) {
            log.warn("Task request rejected: {}", e.getMessage());
            return ControllerResponse.unavailable(e.getMessage());
        } catch (Exception e) {
            log.error("Task controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/tasks - Schedule a task
     */
    private ControllerResponse handleSchedule(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        ScheduleTaskRequest request;
        try {
            request = RouterHandler.mapper().readValue(body, ScheduleTaskRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed JSON: " + e.getOriginalMessage());
        }

        request.validate();

        long waitMs = orchestrator.schedule(
                request.name(),
                request.programPath(),
                request.scheduledTime(),
                request.dependsOn(),
                request.parameters());

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(new ScheduleTaskResponse(request.name(), waitMs)));
    }

    /**
     * GET /api/v1/tasks - List scheduled tasks
     */
    private ControllerResponse handleList() throws Exception {
        List<TaskResponse> tasks = orchestrator.snapshot().stream()
                .map(TaskResponse::from)
                .toList();

        Map<String, Object> response = Map.of(
                "count", tasks.size(),
                "tasks", tasks);

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/tasks/{name} - Get one task
     */
    private ControllerResponse handleGet(String name) throws Exception {
        Optional<Task> task = orchestrator.find(name);
        if (task.isEmpty()) {
            return ControllerResponse.notFound("no such task: " + name);
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(task.get())));
    }

    /**
     * DELETE /api/v1/tasks/{name} - Cancel a task
     */
    private ControllerResponse handleCancel(String name, boolean cascade) throws Exception {
        if (cascade) {
            List<TaskResponse> cancelled = orchestrator.cancelWithDependents(name).stream()
                    .map(TaskResponse::from)
                    .toList();
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("cancelled", cancelled)));
        }
        Task cancelled = orchestrator.cancel(name);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(cancelled)));
    }

    private static boolean isCascade(FullHttpRequest req) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get("cascade");
        return values != null && !values.isEmpty() && Boolean.parseBoolean(values.get(0));
    }
}
