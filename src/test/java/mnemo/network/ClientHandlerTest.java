package mnemo.network;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOutboundHandlerAdapter;
import io.netty.channel.ChannelPromise;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.util.ReferenceCountUtil;
import mnemo.commands.CommandRegistry;
import mnemo.db.DataType;
import mnemo.db.MnemoDatabase;
import mnemo.db.ReservedValue;
import mnemo.protocol.Reply;
import mnemo.protocol.Request;
import mnemo.protocol.Resp;
import mnemo.protocol.netty.NettyRespDecoder;
import mnemo.protocol.netty.NettyRespEncoder;
import mnemo.server.ServerStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ClientHandlerTest {

    private MnemoDatabase db;
    private ServerStats stats;
    private EmbeddedChannel channel;

    @BeforeEach
    public void setUp() {
        db = new MnemoDatabase();
        stats = new ServerStats();
        channel = new EmbeddedChannel(new NettyRespDecoder(), new NettyRespEncoder(),
                new ClientHandler(db, CommandRegistry.defaults(), stats));
    }

    private byte[] sendBytes(byte[] data) {
        channel.writeInbound(Unpooled.wrappedBuffer(data));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteBuf buf;
        while ((buf = channel.readOutbound()) != null) {
            byte[] chunk = new byte[buf.readableBytes()];
            buf.readBytes(chunk);
            out.writeBytes(chunk);
            buf.release();
        }
        return out.toByteArray();
    }

    private String send(String data) {
        return new String(sendBytes(data.getBytes(StandardCharsets.ISO_8859_1)), StandardCharsets.ISO_8859_1);
    }

    @Test
    public void testEchoOverMultibulk() {
        assertEquals("$5\r\nhello\r\n", send("*2\r\n$4\r\nECHO\r\n$5\r\nhello\r\n"));
    }

    @Test
    public void testInlinePing() {
        assertEquals("+PONG\r\n", send("PING\r\n"));
        assertEquals("+hi\r\n", send("PING hi\r\n"));
    }

    @Test
    public void testCommandNamesAreCaseInsensitive() {
        assertEquals("+PONG\r\n", send("*1\r\n$4\r\npInG\r\n"));
        assertEquals("+OK\r\n", send("set k v\r\n"));
        assertEquals("$1\r\nv\r\n", send("Get k\r\n"));
    }

    @Test
    public void testSetArityErrorKeepsConnectionOpen() {
        assertEquals("-ERR wrong number of arguments for 'set' command\r\n", send("*2\r\n$3\r\nSET\r\n$1\r\nk\r\n"));
        assertTrue(channel.isOpen());

        assertEquals("+PONG\r\n", send("PING\r\n"));
    }

    @Test
    public void testArityErrors() {
        assertEquals("-ERR wrong number of arguments for 'get' command\r\n", send("GET\r\n"));
        assertEquals("-ERR wrong number of arguments for 'get' command\r\n", send("GET a b\r\n"));
        assertEquals("-ERR wrong number of arguments for 'set' command\r\n", send("SET a b c\r\n"));
        assertEquals("-ERR wrong number of arguments for 'del' command\r\n", send("DEL\r\n"));
        assertEquals("-ERR wrong number of arguments for 'echo' command\r\n", send("echo\r\n"));
        assertTrue(channel.isOpen());
    }

    @Test
    public void testGetOnSeededNonStringIsWrongType() {
        db.seed("list", new ReservedValue(DataType.LIST));

        assertEquals("-WRONGTYPE Operation against a key holding the wrong kind of value\r\n", send("GET list\r\n"));
        assertTrue(channel.isOpen());
    }

    @Test
    public void testGetMissingKey() {
        assertEquals("$-1\r\n", send("*2\r\n$3\r\nGET\r\n$7\r\nmissing\r\n"));
    }

    @Test
    public void testSetGetDel() {
        assertEquals("+OK\r\n", send("*3\r\n$3\r\nSET\r\n$1\r\na\r\n$1\r\n1\r\n"));
        assertEquals("+OK\r\n", send("SET b 2\r\n"));
        assertEquals("$1\r\n1\r\n", send("GET a\r\n"));

        assertEquals(":2\r\n", send("DEL a b c\r\n"));
        assertEquals(":0\r\n", send("DEL a b c\r\n"));
        assertEquals("$-1\r\n", send("GET a\r\n"));
    }

    @Test
    public void testBinaryValueRoundTrip() {
        byte[] value = {0x00, '\r', '\n', (byte) 0xFF};
        ByteArrayOutputStream frame = new ByteArrayOutputStream();
        frame.writeBytes("*3\r\n$3\r\nSET\r\n$3\r\nbin\r\n$4\r\n".getBytes(StandardCharsets.US_ASCII));
        frame.writeBytes(value);
        frame.writeBytes("\r\n".getBytes(StandardCharsets.US_ASCII));

        assertEquals("+OK\r\n", new String(sendBytes(frame.toByteArray()), StandardCharsets.US_ASCII));

        byte[] reply = sendBytes("GET bin\r\n".getBytes(StandardCharsets.US_ASCII));
        assertArrayEquals(Resp.bulkString(value), reply);
    }

    @Test
    public void testBinaryKey() {
        byte[] frame = {'*', '2', '\r', '\n', '$', '3', '\r', '\n', 'D', 'E', 'L', '\r', '\n',
                '$', '2', '\r', '\n', (byte) 0xC3, (byte) 0xA9, '\r', '\n'};
        db.set(Resp.text(new byte[]{(byte) 0xC3, (byte) 0xA9}), new byte[]{1});

        assertEquals(":1\r\n", new String(sendBytes(frame), StandardCharsets.US_ASCII));
    }

    @Test
    public void testPipelinedRepliesInOrder() {
        assertEquals("+OK\r\n$1\r\nv\r\n:1\r\n$-1\r\n", send("SET k v\r\nGET k\r\nDEL k\r\nGET k\r\n"));
    }

    @Test
    public void testUnknownCommandKeepsConnectionOpen() {
        assertEquals("-ERR unknown command 'foo'\r\n", send("FOO bar\r\n"));
        assertTrue(channel.isOpen());
        assertEquals("+PONG\r\n", send("PING\r\n"));
    }

    @Test
    public void testTaggedFramesDispatchAsUnknownCommands() {
        assertEquals("-ERR unknown command 'error'\r\n", send("-oops\r\n"));
        assertEquals("-ERR unknown command 'integer'\r\n", send(":12\r\n"));
        assertEquals("+PONG\r\n", send("+PING\r\n"));
        assertEquals("+PONG\r\n", send("$4\r\nPING\r\n"));
    }

    @Test
    public void testEmptyArrayGetsNoReply() {
        assertEquals("", send("*0\r\n"));
        assertEquals("+PONG\r\n", send("*0\r\nPING\r\n"));
    }

    @Test
    public void testProtocolErrorRepliesAndCloses() {
        assertEquals("-ERR Protocol error\r\n", send("*1\r\n$x\r\n"));
        assertFalse(channel.isOpen());
    }

    @Test
    public void testCommandsBeforeBadFrameAreAnswered() {
        assertEquals("+PONG\r\n-ERR Protocol error\r\n", send("PING\r\n*1\r\n:1\r\n"));
        assertFalse(channel.isOpen());
    }

    @Test
    public void testTruncatedFrameAtEndOfInputDoesNotExecute() {
        send("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$5\r\nab");
        channel.close();

        assertFalse(db.get("k").isFound());
    }

    @Test
    public void testCommandFailureBecomesErrorReply() {
        CommandRegistry registry = CommandRegistry.defaults();
        registry.register("BOOM", (database, args) -> {
            throw new IllegalStateException("boom");
        }, 1);
        EmbeddedChannel ch = new EmbeddedChannel(new NettyRespDecoder(), new NettyRespEncoder(),
                new ClientHandler(db, registry, stats));

        ch.writeInbound(Unpooled.copiedBuffer("BOOM\r\nPING\r\n", StandardCharsets.US_ASCII));
        ByteBuf first = ch.readOutbound();
        ByteBuf second = ch.readOutbound();
        assertEquals("-ERR boom\r\n", first.toString(StandardCharsets.US_ASCII));
        assertEquals("+PONG\r\n", second.toString(StandardCharsets.US_ASCII));
        first.release();
        second.release();
        assertTrue(ch.isOpen());
    }

    @Test
    public void testWriteFailureClosesConnection() {
        ChannelOutboundHandlerAdapter failingWriter = new ChannelOutboundHandlerAdapter() {
            @Override
            public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) {
                ReferenceCountUtil.release(msg);
                promise.setFailure(new IOException("peer gone"));
            }
        };
        EmbeddedChannel ch = new EmbeddedChannel(failingWriter, new NettyRespDecoder(), new NettyRespEncoder(),
                new ClientHandler(db, CommandRegistry.defaults(), stats));

        ch.writeInbound(Unpooled.copiedBuffer("SET k v\r\n", StandardCharsets.US_ASCII));

        assertFalse(ch.isOpen());
        assertTrue(db.get("k").isFound(), "the command completed before the write failed");
    }

    @Test
    public void testHandleCommandDirectly() {
        ClientHandler handler = new ClientHandler(db);
        assertNull(handler.handleCommand(new Request(Request.Kind.ARRAY, List.of())));

        Reply reply = handler.handleCommand(new Request(Request.Kind.INLINE, List.of(Resp.bytes("PING"))));
        assertEquals("+PONG\r\n", new String(reply.encode(), StandardCharsets.US_ASCII));
    }

    @Test
    public void testStats() {
        assertEquals(1, stats.getActiveConnections());
        send("PING\r\nPING\r\nNOPE\r\n");
        assertEquals(3, stats.getTotalCommands());

        channel.close();
        assertEquals(0, stats.getActiveConnections());
        assertEquals(1, stats.getTotalConnections());
    }
}
