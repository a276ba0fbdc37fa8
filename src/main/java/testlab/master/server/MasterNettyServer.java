package testlab.master.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.GlobalEventExecutor;
import testlab.master.config.MasterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * HTTP front end of the master. One boss thread accepts, worker event loops
 * decode and route; {@link RouterHandler} takes it from there.
 */
public final class MasterNettyServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MasterNettyServer.class);
    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    private final MasterConfig config;
    private final RouterHandler router;
    private final ChannelGroup clients = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

    private volatile boolean running = false;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public MasterNettyServer(MasterConfig config, RouterHandler router) {
        this.config = config;
        this.router = router;
    }

    private ChannelHandler pipelineInitializer() {
        return new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                clients.add(ch);
                ChannelPipeline p = ch.pipeline();
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                p.addLast(router);
            }
        };
    }

    /**
     * Bind and start serving. Port 0 binds an ephemeral port, see {@link #port()}.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer());

            serverChannel = b.bind(config.serverHost(), config.serverPort()).syncUninterruptibly().channel();
            running = true;
            log.info("Lab master listening on {}:{}", config.serverHost(), port());
        } catch (RuntimeException e) {
            log.error("Failed to start HTTP server on port {}", config.serverPort(), e);
            stop();
            throw e;
        }
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
            clients.close().awaitUninterruptibly();
        } finally {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
                bossGroup = null;
            }
            if (running) {
                log.info("Lab master HTTP server stopped");
            }
            running = false;
        }
    }

    public boolean isRunning() {
        return running;
    }

    /** Actual bound port. */
    public int port() {
        Channel ch = serverChannel;
        if (ch == null) {
            throw new IllegalStateException("server is not running");
        }
        return ((InetSocketAddress) ch.localAddress()).getPort();
    }

    @Override
    public void close() {
        stop();
    }
}
