package testlab.master.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import testlab.master.api.Controller;
import testlab.master.api.v1.dto.HealthResponse;
import testlab.master.dispatch.Dispatcher;
import testlab.master.scheduler.SchedulerDaemon;
import testlab.master.server.RouterHandler;
import testlab.master.service.DeviceRegistry;
import testlab.master.service.JobQueue;
import testlab.master.service.QueueMetrics;
import testlab.master.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health of the master itself.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final DeviceRegistry registry;
    private final JobQueue jobQueue;
    private final Dispatcher dispatcher;
    private final SchedulerDaemon daemon;

    public HealthController(Database database, DeviceRegistry registry, JobQueue jobQueue, Dispatcher dispatcher,
            SchedulerDaemon daemon) {
        this.database = database;
        this.registry = registry;
        this.jobQueue = jobQueue;
        this.dispatcher = dispatcher;
        this.daemon = daemon;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (!database.isHealthy()) {
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.toJson(HealthResponse.unhealthy("connection failed")));
        }
        try {
            QueueMetrics metrics = jobQueue.metrics();
            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    registry.findAll().size(),
                    metrics.depth(),
                    metrics.running(),
                    dispatcher.liveCount(),
                    daemon.isRunning());
            return ControllerResponse.json(RouterHandler.toJson(response));
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.toJson(HealthResponse.unhealthy(e.getMessage())));
        }
    }

    private String formatUptime() {
        Duration duration = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
