package kvd.network;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import kvd.Config;
import kvd.protocol.RespDecoder;
import kvd.protocol.RespEncoder;
import kvd.protocol.RespRequestDecoder;
import kvd.utils.Log;

import java.net.InetSocketAddress;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TCP front end. Binds the wildcard address, which is dual-stack where the platform
 * supports it, and gives every accepted channel its own decoder and {@link ClientHandler}.
 */
public class KvServer implements AutoCloseable {
    private final Config config;
    private final CommandDispatcher dispatcher;
    private final AtomicInteger activeConnections = new AtomicInteger(0);

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public KvServer(Config config, CommandDispatcher dispatcher) {
        this.config = config;
        this.dispatcher = dispatcher;
    }

    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("already started");
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.ioThreads);
        RespEncoder encoder = new RespEncoder();
        RespRequestDecoder requestDecoder = new RespRequestDecoder();
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
             .channel(NioServerSocketChannel.class)
             .childOption(ChannelOption.TCP_NODELAY, true)
             .childHandler(new ChannelInitializer<SocketChannel>() {
                 @Override
                 public void initChannel(SocketChannel ch) {
                     ch.pipeline().addLast(new RespDecoder(config.maxNestingDepth, config.maxBulkLength,
                             config.maxArrayLength, config.maxLineLength));
                     ch.pipeline().addLast(requestDecoder);
                     ch.pipeline().addLast(encoder);
                     ch.pipeline().addLast(new ClientHandler(dispatcher, activeConnections));
                 }
             });

            serverChannel = b.bind(new InetSocketAddress(config.port)).sync().channel();
            Log.info("Ready on port " + getPort());
        } catch (Throwable t) {
            shutdownGroups();
            throw t;
        }
    }

    /** Port actually bound, which differs from the configured one when that was 0. */
    public int getPort() {
        if (serverChannel == null) {
            throw new IllegalStateException("not started");
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    /** Blocks until the listening channel is closed. */
    public void awaitTermination() throws InterruptedException {
        Channel ch;
        synchronized (this) {
            ch = serverChannel;
        }
        if (ch != null) {
            ch.closeFuture().sync();
        }
    }

    @Override
    public synchronized void close() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        shutdownGroups();
    }

    private void shutdownGroups() {
        if (bossGroup != null) bossGroup.shutdownGracefully();
        if (workerGroup != null) workerGroup.shutdownGracefully();
    }
}
