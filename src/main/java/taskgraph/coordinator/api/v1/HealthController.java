package taskgraph.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import taskgraph.coordinator.api.Controller;
import taskgraph.coordinator.api.v1.dto.HealthResponse;
import taskgraph.coordinator.model.TaskStatus;
import taskgraph.coordinator.scheduler.Orchestrator;
import taskgraph.coordinator.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.Map;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    static final String VERSION = "1.0.0";

    private final Orchestrator orchestrator;

    public HealthController(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!orchestrator.isRunning()) {
                return ControllerResponse.json(
                        HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(VERSION)));
            }

            Map<TaskStatus, Integer> counts = orchestrator.countByStatus();
            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    counts.getOrDefault(TaskStatus.PENDING, 0),
                    counts.getOrDefault(TaskStatus.ARMED, 0),
                    counts.getOrDefault(TaskStatus.RUNNING, 0));

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.unavailable("health check failed");
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
