package pxefleet.runner.server;

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
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pxefleet.runner.events.ChannelGroupBroadcaster;

import java.net.InetSocketAddress;

/**
 * HTTP API plus the {@code /ws} progress stream on one port.
 */
public final class RunnerNettyServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RunnerNettyServer.class);

    public static final String WEBSOCKET_PATH = "/ws";
    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    private final RouterHandler router;
    private final ChannelGroupBroadcaster broadcaster;

    private volatile boolean running = false;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public RunnerNettyServer(RouterHandler router, ChannelGroupBroadcaster broadcaster) {
        this.router = router;
        this.broadcaster = broadcaster;
    }

    /**
     * Bind and serve.
     *
     * @param host bind address
     * @param port port, 0 for an ephemeral one
     * @return the bound port
     */
    public synchronized int start(String host, int port) {
        if (running) {
            return port();
        }

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline p = ch.pipeline();
                            p.addLast(new HttpServerCodec());
                            p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                            p.addLast(new WebSocketServerProtocolHandler(WEBSOCKET_PATH));
                            p.addLast(new ProgressSocketHandler(broadcaster));
                            p.addLast(router);
                        }
                    });

            serverChannel = b.bind(host, port).syncUninterruptibly().channel();
            running = true;
            log.info("Runner API listening on {}:{}", host, port());
            return port();
        } catch (RuntimeException e) {
            log.error("Failed to start server on {}:{}", host, port, e);
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
            broadcaster.close();
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
                log.info("Runner API stopped");
            }
            running = false;
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public int port() {
        return serverChannel != null ? ((InetSocketAddress) serverChannel.localAddress()).getPort() : -1;
    }
}
