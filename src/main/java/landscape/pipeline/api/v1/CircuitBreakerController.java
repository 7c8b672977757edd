package landscape.pipeline.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import landscape.pipeline.api.Controller;
import landscape.pipeline.api.v1.dto.CircuitBreakerResponse;
import landscape.pipeline.resilience.CircuitBreakerRegistry;
import landscape.pipeline.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Circuit breaker inspection and manual reset.
 *
 * GET /api/v1/circuit-breakers
 * GET /api/v1/circuit-breakers/{name}
 * POST /api/v1/circuit-breakers/{name}/reset
 */
public class CircuitBreakerController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerController.class);

    private static final Pattern ALL_PATTERN = Pattern.compile("^/api/v1/circuit-breakers$");
    private static final Pattern BY_NAME_PATTERN = Pattern.compile("^/api/v1/circuit-breakers/([^/]+)$");
    private static final Pattern RESET_PATTERN = Pattern.compile("^/api/v1/circuit-breakers/([^/]+)/reset$");

    private final CircuitBreakerRegistry breakers;

    public CircuitBreakerController(CircuitBreakerRegistry breakers) {
        this.breakers = breakers;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return ALL_PATTERN.matcher(path).matches() || BY_NAME_PATTERN.matcher(path).matches();
        }
        return method.equals(HttpMethod.POST) && RESET_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (ALL_PATTERN.matcher(path).matches()) {
            List<CircuitBreakerResponse> all = breakers.all().stream()
                    .map(CircuitBreakerResponse::from)
                    .toList();
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                    Map.of("circuitBreakers", all, "count", all.size())));
        }

        Matcher reset = RESET_PATTERN.matcher(path);
        if (reset.matches()) {
            String name = reset.group(1);
            if (!breakers.reset(name)) {
                return ControllerResponse.notFound("circuit breaker not found: " + name);
            }
            log.info("Circuit breaker {} reset via API", name);
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                    Map.of("success", true, "name", name, "state", "CLOSED")));
        }

        Matcher byName = BY_NAME_PATTERN.matcher(path);
        if (byName.matches()) {
            String name = byName.group(1);
            return breakers.metrics(name)
                    .map(CircuitBreakerResponse::from)
                    .map(this::toJson)
                    .orElseGet(() -> ControllerResponse.notFound("circuit breaker not found: " + name));
        }

        return ControllerResponse.notFound("unknown circuit breaker endpoint");
    }

    private ControllerResponse toJson(CircuitBreakerResponse response) {
        try {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize circuit breaker " + response.name(), e);
        }
    }
}
