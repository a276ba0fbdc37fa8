package testlab.master.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import testlab.master.api.Controller;
import testlab.master.api.Controller.ControllerResponse;
import testlab.master.config.MasterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Serves the public API under /api/v1/ and the device-side API under
 * /internal/v1/; the latter is guarded by the {@code X-Lab-Key} header when an
 * agent key is configured. Blocking controllers run on a bounded worker pool
 * and get a 503 when it is exhausted.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    public static final String AGENT_KEY_HEADER = "X-Lab-Key";

    private final List<Controller> controllers = new CopyOnWriteArrayList<>();
    private final MasterConfig config;
    private final ExecutorService blockingExecutor;

    public RouterHandler(MasterConfig config) {
        this.config = config;
        AtomicInteger counter = new AtomicInteger();
        this.blockingExecutor = new ThreadPoolExecutor(0, config.blockingThreads(),
                60, TimeUnit.SECONDS, new SynchronousQueue<>(), r -> {
                    Thread t = new Thread(r, "lab-http-blocking-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        if (!checkAuth(req, path)) {
            log.warn("Auth failed for {} {}", method, path);
            writeSafe(ctx, ControllerResponse.forbidden("forbidden"));
            return;
        }

        for (Controller controller : controllers) {
            if (!controller.matches(method, path)) {
                continue;
            }
            if (!controller.blocking()) {
                writeSafe(ctx, invoke(controller, ctx, req, method, path));
                return;
            }
            // The request is released by SimpleChannelInboundHandler once we return.
            req.retain();
            try {
                blockingExecutor.execute(() -> {
                    try {
                        writeSafe(ctx, invoke(controller, ctx, req, method, path));
                    } finally {
                        req.release();
                    }
                });
            } catch (RejectedExecutionException e) {
                req.release();
                log.warn("Blocking pool exhausted, refusing {} {}", method, path);
                writeSafe(ctx, ControllerResponse.unavailable("server busy"));
            }
            return;
        }

        log.debug("No handler for: {} {}", method, path);
        writeSafe(ctx, ControllerResponse.notFound("not found"));
    }

    private ControllerResponse invoke(Controller controller, ChannelHandlerContext ctx, FullHttpRequest req,
            HttpMethod method, String path) {
        try {
            return controller.handle(ctx, req, path);
        } catch (NoSuchElementException e) {
            return ControllerResponse.notFound(e.getMessage());
        } catch (IllegalStateException e) {
            log.debug("Conflict on {} {}: {}", method, path, e.getMessage());
            return ControllerResponse.conflict(e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Validation error on {} {}: {}", method, path, e.getMessage());
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Handler error: {} {} - Body: [{}]", method, path,
                    req.content().toString(StandardCharsets.UTF_8), e);
            return ControllerResponse.error(errorChain(e));
        }
    }

    private boolean checkAuth(FullHttpRequest req, String path) {
        if (!config.hasAgentKey()) {
            return true;
        }
        if (!path.startsWith("/internal/")) {
            return true;
        }
        String providedKey = req.headers().get(AGENT_KEY_HEADER);
        return config.agentKey().equals(providedKey);
    }

    private void writeSafe(ChannelHandlerContext ctx, ControllerResponse response) {
        try {
            String body = response.body() == null ? "" : response.body();
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            FullHttpResponse http = new DefaultFullHttpResponse(HTTP_1_1, response.status(),
                    Unpooled.wrappedBuffer(bytes));
            http.headers().set(CONTENT_TYPE, response.contentType() + "; charset=utf-8");
            http.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(http);
        } catch (RuntimeException e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            writeSafe(ctx, new ControllerResponse(INTERNAL_SERVER_ERROR, "application/json",
                    "{\"error\":\"channel error: " + escapeJson(cause.getMessage()) + "\"}"));
        } finally {
            ctx.close();
        }
    }

    /** Stop accepting blocking work; waiting calls are interrupted. */
    public void shutdown() {
        blockingExecutor.shutdownNow();
    }

    private static String errorChain(Throwable t) {
        StringBuilder chain = new StringBuilder(t.toString());
        Throwable cause = t.getCause();
        while (cause != null) {
            chain.append(" <- ").append(cause);
            cause = cause.getCause();
        }
        return chain.toString();
    }

    private static String escapeJson(String s) {
        if (s == null)
            return "";
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "\\r");
    }

    /**
     * Shared ObjectMapper for request and response bodies.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Serialize a response body, turning Jackson's checked failure into an unchecked one.
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize response", e);
        }
    }

    /**
     * Parse a request body into the given type; malformed JSON is a 400.
     */
    public static <T> T readBody(FullHttpRequest req, Class<T> type) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        try {
            return MAPPER.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid JSON: " + e.getOriginalMessage());
        }
    }
}
