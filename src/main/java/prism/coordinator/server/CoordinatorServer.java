package prism.coordinator.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * Netty HTTP server for the coordinator API.
 * Request handling runs on a separate executor group so that JDBC work never
 * blocks the I/O event loops.
 */
public final class CoordinatorServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorServer.class);

    /** Maximum request body, large enough for trace uploads */
    static final int MAX_CONTENT_LENGTH = 256 * 1024 * 1024;

    private final RouterHandler router;
    private final String host;
    private final int port;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup handlerGroup;
    private Channel serverChannel;

    public CoordinatorServer(RouterHandler router, String host, int port) {
        this.router = router;
        this.host = host;
        this.port = port;
    }

    /**
     * Bind and start serving. Port 0 picks a free port.
     */
    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        handlerGroup = new DefaultEventExecutorGroup(16);

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
                        p.addLast(handlerGroup, router);
                    }
                });

        try {
            serverChannel = b.bind(host, port).sync().channel();
        } catch (Exception e) {
            stop();
            throw e;
        }
        log.info("Coordinator listening on {}:{}", host, boundPort());
    }

    /**
     * @return the bound port, or -1 when not running
     */
    public int boundPort() {
        Channel ch = serverChannel;
        return ch != null ? ((InetSocketAddress) ch.localAddress()).getPort() : -1;
    }

    public boolean isRunning() {
        return serverChannel != null && serverChannel.isActive();
    }

    /**
     * Block until the server channel closes.
     */
    public void awaitTermination() throws InterruptedException {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.closeFuture().sync();
        }
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (handlerGroup != null) {
                handlerGroup.shutdownGracefully();
                handlerGroup = null;
            }
            if (workerGroup != null) {
                workerGroup.shutdownGracefully();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
                bossGroup = null;
            }
            log.info("Coordinator server stopped");
        }
    }

    @Override
    public void close() {
        stop();
    }
}
