package mnemo.network;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.DecoderException;
import io.netty.util.ReferenceCountUtil;
import mnemo.commands.CommandContainer;
import mnemo.commands.CommandRegistry;
import mnemo.commands.Errors;
import mnemo.db.MnemoDatabase;
import mnemo.protocol.Reply;
import mnemo.protocol.Request;
import mnemo.server.ServerStats;
import mnemo.utils.Log;

import java.io.IOException;
import java.util.List;

/**
 * Serves one connection. Netty calls every method on the channel's event
 * loop, so requests are executed and answered strictly in arrival order.
 */
public class ClientHandler extends ChannelInboundHandlerAdapter {

    private static final ChannelFutureListener CLOSE_ON_WRITE_FAILURE = future -> {
        if (!future.isSuccess()) {
            Log.warn("Write to " + future.channel().remoteAddress() + " failed: " + future.cause());
            future.channel().close();
        }
    };

    private final MnemoDatabase db;
    private final CommandRegistry registry;
    private final ServerStats stats;

    public ClientHandler(MnemoDatabase db, CommandRegistry registry, ServerStats stats) {
        this.db = db;
        this.registry = registry;
        this.stats = stats;
    }

    public ClientHandler(MnemoDatabase db) {
        this(db, CommandRegistry.defaults(), new ServerStats());
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        stats.connectionOpened();
        if (Log.isDebugEnabled()) {
            Log.debug("Client connected: " + ctx.channel().remoteAddress());
        }
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        stats.connectionClosed();
        if (Log.isDebugEnabled()) {
            Log.debug("Client disconnected: " + ctx.channel().remoteAddress());
        }
        super.channelInactive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (msg instanceof Request) {
            Reply reply = handleCommand((Request) msg);
            if (reply != null) {
                ctx.writeAndFlush(reply).addListener(CLOSE_ON_WRITE_FAILURE);
            }
        } else {
            ReferenceCountUtil.release(msg);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            Log.warn("Protocol error from " + ctx.channel().remoteAddress() + ": " + cause.getMessage());
            if (ctx.channel().isActive()) {
                ctx.writeAndFlush(Reply.error(Errors.PROTOCOL)).addListener(ChannelFutureListener.CLOSE);
            } else {
                ctx.close();
            }
        } else if (cause instanceof IOException) {
            // Peer reset or similar
            Log.debug("Connection error on " + ctx.channel().remoteAddress() + ": " + cause.getMessage());
            ctx.close();
        } else {
            Log.error("Unexpected error on " + ctx.channel().remoteAddress(), cause);
            ctx.close();
        }
    }

    /**
     * Runs one request against the store.
     *
     * @return the reply to send, or null if the request carries no command
     */
    public Reply handleCommand(Request request) {
        if (request.isEmpty()) return null;
        stats.commandProcessed();

        String name = request.getName();
        CommandContainer container = registry.get(name);
        if (container == null) {
            return Reply.error(Errors.unknownCommand(name));
        }

        List<byte[]> args = request.getArgs();
        if (!container.getMetadata().acceptsArgCount(args.size())) {
            return Reply.error(Errors.wrongArity(container.getName()));
        }

        try {
            return container.getCommand().execute(db, args);
        } catch (RuntimeException e) {
            Log.error("Command " + container.getName() + " failed", e);
            return Reply.error("ERR " + e.getMessage());
        }
    }
}
