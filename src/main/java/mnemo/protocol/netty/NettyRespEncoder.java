package mnemo.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import mnemo.protocol.Reply;

/**
 * Writes {@link Reply} objects in RESP format. Stateless, so one instance
 * can serve every channel.
 */
@ChannelHandler.Sharable
public class NettyRespEncoder extends MessageToByteEncoder<Reply> {

    @Override
    protected void encode(ChannelHandlerContext ctx, Reply msg, ByteBuf out) throws Exception {
        out.writeBytes(msg.encode());
    }
}
