package bigo.conductor.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server for the conductor API.
 */
public final class ConductorHttpServer {

    private static final Logger log = LoggerFactory.getLogger(ConductorHttpServer.class);

    static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    private final RouterHandler router;
    private final String host;
    private final int executorThreads;

    private volatile boolean running = false;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup handlerGroup;

    public ConductorHttpServer(RouterHandler router, String host, int executorThreads) {
        this.router = router;
        this.host = host;
        this.executorThreads = executorThreads;
    }

    public synchronized boolean start(int port) {
        if (running) return true;
        try {
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();
            handlerGroup = new DefaultEventExecutorGroup(executorThreads);

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline p = ch.pipeline();
                            p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                            p.addLast(new HttpServerCodec());
                            p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                            p.addLast(handlerGroup, router);
                        }
                    });

            serverChannel = b.bind(host, port).syncUninterruptibly().channel();
            running = true;
            log.info("Conductor API listening on {}:{}", host, port);
            return true;
        } catch (Exception e) {
            log.error("Failed to start server on port {}", port, e);
            stop();
            return false;
        }
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (handlerGroup != null) { handlerGroup.shutdownGracefully(); handlerGroup = null; }
            if (workerGroup != null) { workerGroup.shutdownGracefully(); workerGroup = null; }
            if (bossGroup != null) { bossGroup.shutdownGracefully(); bossGroup = null; }
            if (running) {
                log.info("Conductor API stopped");
            }
            running = false;
        }
    }

    public boolean isRunning() {
        return running;
    }
}
