package mnemo.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import mnemo.Config;
import mnemo.commands.CommandRegistry;
import mnemo.db.MnemoDatabase;
import mnemo.network.ClientHandler;
import mnemo.protocol.netty.NettyRespDecoder;
import mnemo.protocol.netty.NettyRespEncoder;
import mnemo.utils.Log;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * TCP listener. One boss thread accepts; each accepted channel gets its own
 * decoder and {@link ClientHandler} bound to the shared database.
 */
public class MnemoServer {
    private final Config config;
    private final MnemoDatabase db;
    private final CommandRegistry registry;
    private final ServerStats stats = new ServerStats();
    private final NettyRespEncoder encoder = new NettyRespEncoder();

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public MnemoServer(Config config, MnemoDatabase db) {
        this(config, db, CommandRegistry.defaults());
    }

    public MnemoServer(Config config, MnemoDatabase db, CommandRegistry registry) {
        this.config = config;
        this.db = db;
        this.registry = registry;
    }

    /**
     * Binds {@code port} (0 picks a free one) and returns once the server
     * accepts connections.
     */
    public synchronized void start(int port) throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("Server already started on port " + getPort());
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.workerThreads);
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
             .channel(NioServerSocketChannel.class)
             .childOption(ChannelOption.TCP_NODELAY, true)
             .childHandler(new ChannelInitializer<SocketChannel>() {
                 @Override
                 public void initChannel(SocketChannel ch) throws Exception {
                     ch.pipeline().addLast(new NettyRespDecoder(config));
                     ch.pipeline().addLast(encoder);
                     ch.pipeline().addLast(new ClientHandler(db, registry, stats));
                 }
             });

            serverChannel = b.bind(config.bind, port).sync().channel();
        } catch (InterruptedException | RuntimeException e) {
            shutdownGroups();
            throw e;
        } catch (Exception e) {
            // bind() failures such as BindException surface here
            shutdownGroups();
            throw new IllegalStateException("Failed to bind " + config.bind + ":" + port, e);
        }
        Log.info("Ready on " + config.bind + ":" + getPort());
        Log.debug("Commands: " + registry.names());
    }

    public int getPort() {
        Channel channel = serverChannel;
        if (channel == null) throw new IllegalStateException("Server not started");
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    public boolean isRunning() {
        Channel channel = serverChannel;
        return channel != null && channel.isActive();
    }

    public ServerStats getStats() {
        return stats;
    }

    /**
     * Blocks until the server channel closes.
     */
    public void awaitTermination() throws InterruptedException {
        Channel channel;
        synchronized (this) {
            channel = serverChannel;
        }
        if (channel != null) channel.closeFuture().sync();
    }

    public synchronized void stop() {
        if (serverChannel == null) return;
        Log.info("Stopping server on port " + getPort());
        serverChannel.close().syncUninterruptibly();
        shutdownGroups();
        serverChannel = null;
    }

    private void shutdownGroups() {
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
            bossGroup = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
            workerGroup = null;
        }
    }
}
