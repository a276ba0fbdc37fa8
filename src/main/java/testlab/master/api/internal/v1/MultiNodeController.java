package testlab.master.api.internal.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import testlab.master.api.Controller;
import testlab.master.api.internal.v1.dto.BarrierRequest;
import testlab.master.api.internal.v1.dto.ReceiveRequest;
import testlab.master.api.internal.v1.dto.SendRequest;
import testlab.master.api.internal.v1.dto.SyncResponse;
import testlab.master.config.MasterConfig;
import testlab.master.multinode.Message;
import testlab.master.multinode.MultiNodeCoordinator;
import testlab.master.multinode.SyncResult;
import testlab.master.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Group synchronization for devices running outside the master (internal API).
 *
 * POST /internal/v1/groups/{groupId}/barrier - Wait until every role has arrived
 * POST /internal/v1/groups/{groupId}/send - Post a message to roles of the group
 * POST /internal/v1/groups/{groupId}/receive - Wait for a message
 *
 * Barrier and receive hold the request until the wait ends, so this
 * controller runs on the router's blocking pool.
 */
public class MultiNodeController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(MultiNodeController.class);

    private static final Pattern GROUP_OP_PATTERN =
            Pattern.compile("^/internal/v1/groups/([^/]+)/(barrier|send|receive)$");

    private final MultiNodeCoordinator coordinator;
    private final Duration defaultTimeout;
    private final Duration maxTimeout;

    public MultiNodeController(MultiNodeCoordinator coordinator, MasterConfig config) {
        this.coordinator = coordinator;
        this.defaultTimeout = config.defaultSyncTimeout();
        this.maxTimeout = config.maxSyncTimeout();
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && GROUP_OP_PATTERN.matcher(path).matches();
    }

    @Override
    public boolean blocking() {
        return true;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher m = GROUP_OP_PATTERN.matcher(path);
        if (!m.matches()) {
            return ControllerResponse.notFound("unknown group endpoint");
        }
        String groupId = m.group(1);
        try {
            SyncResponse response = switch (m.group(2)) {
                case "barrier" -> barrier(groupId, RouterHandler.readBody(req, BarrierRequest.class));
                case "send" -> send(groupId, RouterHandler.readBody(req, SendRequest.class));
                default -> receive(groupId, RouterHandler.readBody(req, ReceiveRequest.class));
            };
            return ControllerResponse.json(RouterHandler.toJson(response));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Group {} {} interrupted", groupId, m.group(2));
            return ControllerResponse.unavailable("interrupted");
        }
    }

    private SyncResponse barrier(String groupId, BarrierRequest request) throws InterruptedException {
        request.validate();
        SyncResult<Map<String, Map<String, String>>> result = coordinator.waitBarrier(groupId, request.syncId(),
                request.participant(), request.payload(), timeout(request.timeoutMs()));
        return SyncResponse.fromBarrier(result);
    }

    private SyncResponse send(String groupId, SendRequest request) {
        request.validate();
        SyncResult<Message> result = coordinator.sendMessage(groupId, request.messageId(), request.participant(),
                request.toRoles(), request.payload());
        return SyncResponse.fromMessage(result);
    }

    private SyncResponse receive(String groupId, ReceiveRequest request) throws InterruptedException {
        request.validate();
        SyncResult<Message> result = coordinator.receiveMessage(groupId, request.messageId(),
                request.participant(), timeout(request.timeoutMs()));
        return SyncResponse.fromMessage(result);
    }

    /** Requested timeout, defaulted when absent and capped at the configured maximum. */
    Duration timeout(Long timeoutMs) {
        if (timeoutMs == null || timeoutMs <= 0) {
            return defaultTimeout;
        }
        Duration requested = Duration.ofMillis(timeoutMs);
        return requested.compareTo(maxTimeout) > 0 ? maxTimeout : requested;
    }
}
