package landscape.pipeline.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import landscape.pipeline.api.Controller;
import landscape.pipeline.api.v1.dto.HealthResponse;
import landscape.pipeline.model.CircuitState;
import landscape.pipeline.model.ExecutionStatus;
import landscape.pipeline.repository.ExecutionRepository;
import landscape.pipeline.resilience.CircuitBreakerRegistry;
import landscape.pipeline.server.RouterHandler;
import landscape.pipeline.store.Database;
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

    private final Database database;
    private final ExecutionRepository executions;
    private final CircuitBreakerRegistry breakers;

    public HealthController(Database database, ExecutionRepository executions, CircuitBreakerRegistry breakers) {
        this.database = database;
        this.executions = executions;
        this.breakers = breakers;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (!database.isHealthy()) {
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy("connection failed")));
        }
        try {
            int running = executions.findByStatus(ExecutionStatus.RUNNING).size();
            int openCircuits = (int) breakers.all().stream()
                    .filter(state -> state.state() == CircuitState.OPEN)
                    .count();
            HealthResponse response = HealthResponse.healthy(formatUptime(), VERSION, running, openCircuits);
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(e.getMessage())));
        }
    }

    private String formatUptime() {
        Duration duration = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
