package landscape.pipeline.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import landscape.pipeline.api.Controller;
import landscape.pipeline.api.v1.dto.QueueStatsResponse;
import landscape.pipeline.server.RouterHandler;
import landscape.pipeline.service.JobQueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Queue statistics and dead-letter recovery.
 *
 * GET /api/v1/queues/{name}
 * POST /api/v1/queues/{name}/dead-letters/retry
 */
public class QueueController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(QueueController.class);

    private static final Pattern STATS_PATTERN = Pattern.compile("^/api/v1/queues/([^/]+)$");
    private static final Pattern RETRY_PATTERN = Pattern.compile("^/api/v1/queues/([^/]+)/dead-letters/retry$");

    private final JobQueueService queue;

    public QueueController(JobQueueService queue) {
        this.queue = queue;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return STATS_PATTERN.matcher(path).matches();
        }
        return method.equals(HttpMethod.POST) && RETRY_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        Matcher retry = RETRY_PATTERN.matcher(path);
        if (retry.matches()) {
            String name = retry.group(1);
            int requeued = queue.retryDeadLetters(name);
            log.info("Requeued {} dead-letter jobs in {}", requeued, name);
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                    Map.of("success", true, "queue", name, "requeued", requeued)));
        }

        Matcher stats = STATS_PATTERN.matcher(path);
        if (stats.matches()) {
            QueueStatsResponse response = QueueStatsResponse.from(queue.stats(stats.group(1)));
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        }

        return ControllerResponse.notFound("unknown queue endpoint");
    }
}
