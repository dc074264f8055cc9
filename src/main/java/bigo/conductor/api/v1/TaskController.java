package bigo.conductor.api.v1;

import bigo.conductor.api.Controller;
import bigo.conductor.api.v1.dto.RunResponse;
import bigo.conductor.api.v1.dto.TaskRequest;
import bigo.conductor.api.v1.dto.TaskResponse;
import bigo.conductor.model.RunResult;
import bigo.conductor.model.Task;
import bigo.conductor.server.RouterHandler;
import bigo.conductor.service.Conductor;
import bigo.conductor.service.LedgerService;
import bigo.conductor.worker.ExecutionContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for task runs and the task ledger (public API).
 *
 * POST /api/v1/tasks - Run a task through the pipeline
 * POST /api/v1/tasks/dry-run - Preview classification and routing
 * GET /api/v1/tasks?limit=n - Recent tasks
 * GET /api/v1/tasks/{taskId} - Task with its execution attempts
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern DRY_RUN_PATTERN = Pattern.compile("^/api/v1/tasks/dry-run$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");

    static final int DEFAULT_LIMIT = 20;

    private final Conductor conductor;
    private final LedgerService ledger;
    private final Duration runTimeout;

    public TaskController(Conductor conductor, LedgerService ledger, Duration runTimeout) {
        this.conductor = conductor;
        this.ledger = ledger;
        this.runTimeout = runTimeout;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return TASKS_PATTERN.matcher(path).matches() || DRY_RUN_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return TASKS_PATTERN.matcher(path).matches() || TASK_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST)) {
                if (DRY_RUN_PATTERN.matcher(path).matches()) {
                    return handleDryRun(req);
                }
                return handleRun(req);
            }

            if (TASKS_PATTERN.matcher(path).matches()) {
                return handleList(req);
            }

            Matcher taskMatcher = TASK_BY_ID_PATTERN.matcher(path);
            if (taskMatcher.matches()) {
                return handleGetTask(taskMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown task endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid request body: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        }
    }

    /**
     * POST /api/v1/tasks - Run a task
     */
    private ControllerResponse handleRun(FullHttpRequest req) throws JsonProcessingException {
        TaskRequest request = readRequest(req);
        RunResult result = conductor.run(ExecutionContext.withTimeout(runTimeout),
                request.title(), request.descriptionOrEmpty(), request.forcedTier());
        log.info("Run {} finished: {}", result.taskId(), result.status());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(RunResponse.from(result)));
    }

    /**
     * POST /api/v1/tasks/dry-run - Preview a run
     */
    private ControllerResponse handleDryRun(FullHttpRequest req) throws JsonProcessingException {
        TaskRequest request = readRequest(req);
        RunResult result = conductor.dryRun(request.title(), request.descriptionOrEmpty(), request.forcedTier());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(RunResponse.from(result)));
    }

    /**
     * GET /api/v1/tasks - Recent tasks, newest first
     */
    private ControllerResponse handleList(FullHttpRequest req) throws JsonProcessingException {
        int limit = DEFAULT_LIMIT;
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get("limit");
        if (values != null && !values.isEmpty()) {
            try {
                limit = Integer.parseInt(values.get(0));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("limit must be a number");
            }
        }
        List<TaskResponse> tasks = ledger.findRecentTasks(limit).stream().map(TaskResponse::from).toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("tasks", tasks, "count", tasks.size())));
    }

    /**
     * GET /api/v1/tasks/{taskId} - Task details
     */
    private ControllerResponse handleGetTask(String taskId) throws JsonProcessingException {
        Optional<Task> task = ledger.getTask(taskId);
        if (task.isEmpty()) {
            return ControllerResponse.notFound("task not found: " + taskId);
        }
        TaskResponse response = TaskResponse.from(task.get(), ledger.findExecutions(taskId));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    static TaskRequest readRequest(FullHttpRequest req) throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        TaskRequest request = RouterHandler.mapper().readValue(body, TaskRequest.class);
        request.validate();
        return request;
    }
}
