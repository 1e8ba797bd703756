package taskline.coordinator.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.cors.CorsConfig;
import io.netty.handler.codec.http.cors.CorsConfigBuilder;
import io.netty.handler.codec.http.cors.CorsHandler;
import io.netty.handler.timeout.IdleStateHandler;
import taskline.coordinator.config.CoordinatorConfig;
import taskline.coordinator.config.Dependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server hosting the task API, together with the dependencies it
 * serves (signal bus, workers, maintenance).
 */
public final class TasklineServer {

    private static final Logger log = LoggerFactory.getLogger(TasklineServer.class);

    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    private static volatile boolean running = false;
    private static Channel serverChannel;
    private static EventLoopGroup bossGroup;
    private static EventLoopGroup workerGroup;
    private static Dependencies dependencies;

    private TasklineServer() {
    }

    /** HTTP pipeline: codec, aggregation, CORS, routing. */
    static ChannelInitializer<SocketChannel> pipelineInitializer(RouterHandler router) {
        CorsConfig cors = CorsConfigBuilder.forAnyOrigin()
                .allowedRequestMethods(HttpMethod.GET, HttpMethod.POST, HttpMethod.OPTIONS)
                .allowedRequestHeaders(HttpHeaderNames.CONTENT_TYPE.toString(), RouterHandler.AGENT_KEY_HEADER)
                .allowCredentials()
                .build();

        return new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                p.addLast(new CorsHandler(cors));
                p.addLast(router);
            }
        };
    }

    /**
     * Wire dependencies from the config, start them, and bind the HTTP port.
     *
     * @return true if the server is running afterwards
     */
    public static synchronized boolean start(int port, CoordinatorConfig config) {
        if (running) {
            return true;
        }
        try {
            dependencies = Dependencies.create(config);
            dependencies.start();

            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer(dependencies.routerHandler()));

            serverChannel = b.bind(config.serverHost(), port).syncUninterruptibly().channel();
            running = true;
            log.info("Taskline server started on {}:{}", config.serverHost(), port);
            return true;
        } catch (Exception e) {
            log.error("Failed to start Taskline server on port {}", port, e);
            shutdown();
            return false;
        }
    }

    public static synchronized void stop() {
        if (!running) {
            return;
        }
        shutdown();
        log.info("Taskline server stopped");
    }

    private static void shutdown() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
                bossGroup = null;
            }
            if (dependencies != null) {
                dependencies.close();
                dependencies = null;
            }
            running = false;
        }
    }

    /**
     * Block until the server channel closes.
     */
    public static void awaitShutdown() throws InterruptedException {
        Channel channel = serverChannel;
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }

    public static boolean isRunning() {
        return running;
    }

    /**
     * Dependencies of the running server, or null when stopped.
     */
    public static Dependencies dependencies() {
        return dependencies;
    }
}
