package taskgraph.coordinator.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import taskgraph.coordinator.config.CoordinatorConfig;
import taskgraph.coordinator.config.Dependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide HTTP front end for the orchestrator.
 * Owns the {@link Dependencies} it serves and closes them on stop.
 */
public final class CoordinatorNettyServer {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorNettyServer.class);

    private static volatile boolean running = false;
    private static Channel serverChannel;
    private static EventLoopGroup bossGroup;
    private static EventLoopGroup workerGroup;
    private static Dependencies dependencies;

    private CoordinatorNettyServer() {
    }

    /** HTTP pipeline: codec, 1 MiB aggregation, router */
    public static ChannelHandler pipelineInitializer(RouterHandler router) {
        return new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(1024 * 1024));
                p.addLast(router);
            }
        };
    }

    public static synchronized boolean start(CoordinatorConfig config) {
        return start(config.serverPort(), config);
    }

    public static synchronized boolean start(int port, CoordinatorConfig config) {
        return start(port, config.serverHost(), Dependencies.create(config));
    }

    /**
     * Start serving the given dependencies. Ownership passes to the server.
     *
     * @return true if the server is running afterwards
     */
    public static synchronized boolean start(int port, String host, Dependencies deps) {
        if (running) {
            log.warn("Coordinator already running on port {}", boundPort());
            deps.close();
            return true;
        }
        try {
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();
            dependencies = deps;

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer(deps.routerHandler()));

            serverChannel = b.bind(host, port).syncUninterruptibly().channel();
            running = true;
            log.info("Coordinator started on {}:{}", host, boundPort());
            return true;
        } catch (Exception e) {
            log.error("Start error: {}", e.getMessage(), e);
            running = true; // let stop() release whatever was created
            stop();
            return false;
        }
    }

    public static synchronized void stop() {
        if (!running) return;
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) { workerGroup.shutdownGracefully(); workerGroup = null; }
            if (bossGroup != null)   { bossGroup.shutdownGracefully();   bossGroup = null;   }
            if (dependencies != null) { dependencies.close(); dependencies = null; }
            running = false;
            log.info("Coordinator stopped");
        }
    }

    public static boolean isRunning() { return running; }

    /** Actual listening port (useful when started on port 0), or -1 */
    public static synchronized int boundPort() {
        if (serverChannel == null) return -1;
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public static synchronized Dependencies dependencies() {
        return dependencies;
    }
}
