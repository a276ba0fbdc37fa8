package testlab.master.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import testlab.master.api.Controller;
import testlab.master.server.RouterHandler;
import testlab.master.service.JobQueue;

/**
 * GET /api/v1/queue - queue depth, scheduled/running counts, age of the
 * oldest waiting job and pending jobs per device type.
 */
public class QueueController implements Controller {

    private final JobQueue jobQueue;

    public QueueController(JobQueue jobQueue) {
        this.jobQueue = jobQueue;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/queue".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        return ControllerResponse.json(RouterHandler.toJson(jobQueue.metrics()));
    }
}
