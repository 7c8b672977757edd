package landscape.pipeline.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import landscape.pipeline.api.Controller;
import landscape.pipeline.api.QueryParams;
import landscape.pipeline.api.v1.dto.ExecutionSummaryResponse;
import landscape.pipeline.api.v1.dto.PipelineStatusResponse;
import landscape.pipeline.api.v1.dto.StartPipelineRequest;
import landscape.pipeline.config.ExecutionConfig;
import landscape.pipeline.server.RouterHandler;
import landscape.pipeline.service.PipelineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for pipeline executions (public API).
 *
 * POST /api/v1/pipelines - Start a new execution
 * GET /api/v1/pipelines?limit=N - List recent executions
 * GET /api/v1/pipelines/{executionId} - Get execution status
 * DELETE /api/v1/pipelines/{executionId} - Cancel an execution
 * POST /api/v1/pipelines/{executionId}/resume - Resume an interrupted execution
 */
public class PipelineController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(PipelineController.class);

    private static final Pattern PIPELINES_PATTERN = Pattern.compile("^/api/v1/pipelines$");
    private static final Pattern PIPELINE_BY_ID_PATTERN = Pattern.compile("^/api/v1/pipelines/([^/]+)$");
    private static final Pattern RESUME_PATTERN = Pattern.compile("^/api/v1/pipelines/([^/]+)/resume$");

    private static final int DEFAULT_LIMIT = 20;

    private final PipelineService pipelineService;

    public PipelineController(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return PIPELINES_PATTERN.matcher(path).matches() || RESUME_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return PIPELINES_PATTERN.matcher(path).matches() || PIPELINE_BY_ID_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.DELETE)) {
            return PIPELINE_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        HttpMethod method = req.method();

        if (PIPELINES_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) ? handleStart(req) : handleList(req);
        }

        Matcher resumeMatcher = RESUME_PATTERN.matcher(path);
        if (method.equals(HttpMethod.POST) && resumeMatcher.matches()) {
            return handleResume(resumeMatcher.group(1));
        }

        Matcher idMatcher = PIPELINE_BY_ID_PATTERN.matcher(path);
        if (idMatcher.matches()) {
            String executionId = idMatcher.group(1);
            return method.equals(HttpMethod.DELETE) ? handleCancel(executionId) : handleStatus(executionId);
        }

        return ControllerResponse.notFound("unknown pipeline endpoint");
    }

    /**
     * POST /api/v1/pipelines - Start a new execution
     */
    private ControllerResponse handleStart(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        StartPipelineRequest request = body.isBlank()
                ? new StartPipelineRequest(null, null, null, null, null, null)
                : RouterHandler.mapper().readValue(body, StartPipelineRequest.class);

        ExecutionConfig executionConfig = request.toExecutionConfig();
        String executionId = pipelineService.start(executionConfig);
        log.info("Started execution {} via API", executionId);

        Map<String, Object> response = Map.of(
                "success", true,
                "executionId", executionId,
                "status", "PENDING");
        return ControllerResponse.json(HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/pipelines?limit=N - List recent executions
     */
    private ControllerResponse handleList(FullHttpRequest req) throws Exception {
        int limit = QueryParams.intParam(req.uri(), "limit", DEFAULT_LIMIT);
        List<ExecutionSummaryResponse> executions = pipelineService.recent(limit).stream()
                .map(ExecutionSummaryResponse::from)
                .toList();
        Map<String, Object> response = Map.of(
                "executions", executions,
                "count", executions.size());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/pipelines/{executionId} - Get execution status
     */
    private ControllerResponse handleStatus(String executionId) throws Exception {
        PipelineStatusResponse response = PipelineStatusResponse.from(pipelineService.status(executionId));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * DELETE /api/v1/pipelines/{executionId} - Cancel an execution
     */
    private ControllerResponse handleCancel(String executionId) throws Exception {
        if (!pipelineService.cancel(executionId)) {
            return ControllerResponse.conflict("execution already finished");
        }
        Map<String, Object> response = Map.of(
                "success", true,
                "executionId", executionId,
                "cancelRequested", true);
        return ControllerResponse.json(HttpResponseStatus.ACCEPTED,
                RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * POST /api/v1/pipelines/{executionId}/resume - Resume an interrupted execution
     */
    private ControllerResponse handleResume(String executionId) throws Exception {
        pipelineService.resume(executionId);
        Map<String, Object> response = Map.of(
                "success", true,
                "executionId", executionId);
        return ControllerResponse.json(HttpResponseStatus.ACCEPTED,
                RouterHandler.mapper().writeValueAsString(response));
    }
}
