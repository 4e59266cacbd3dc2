package mnemo.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.CorruptedFrameException;
import mnemo.Config;
import mnemo.protocol.Request;
import mnemo.protocol.Resp;

import java.util.ArrayList;
import java.util.List;

/**
 * Netty decoder for RESP frames. Emits one {@link Request} per frame.
 *
 * <p>A multi-bulk array is parsed element by element: elements already read
 * are kept in {@link #currentArray} between calls, together with the length
 * of a bulk whose header has been consumed, so a frame that arrives in many
 * chunks is scanned once. Any other frame is parsed whole; if the cumulation
 * ends inside it, the reader index is restored and nothing is emitted until
 * more bytes arrive. Malformed input raises {@link CorruptedFrameException};
 * after that every further byte on the channel is discarded.
 */
public class NettyRespDecoder extends ByteToMessageDecoder {

    private static final byte[] EMPTY = new byte[0];

    private final long maxBulkLength;
    private final int maxInlineLength;
    private final int maxMultibulkLength;

    private boolean failed = false;

    // Multi-bulk state
    private List<byte[]> currentArray = null;
    private int multiBulkLength = 0;
    private int pendingBulkLength = -1; // payload length once a "$<n>" header is consumed

    public NettyRespDecoder() {
        this(new Config());
    }

    public NettyRespDecoder(Config config) {
        this.maxBulkLength = Math.min(config.maxBulkLength, Integer.MAX_VALUE - 8);
        this.maxInlineLength = config.maxInlineLength;
        this.maxMultibulkLength = config.maxMultibulkLength;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        if (failed) {
            in.skipBytes(in.readableBytes());
            return;
        }
        int start = in.readerIndex();
        boolean complete;
        try {
            complete = currentArray != null ? readElements(in, out) : readFrame(in, out);
        } catch (CorruptedFrameException e) {
            failed = true;
            resetArray();
            in.skipBytes(in.readableBytes());
            throw e;
        }
        if (!complete && currentArray == null) {
            in.readerIndex(start); // Wait for more data
        }
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        if (!in.isReadable() && currentArray == null) {
            return; // Clean end of input
        }
        decode(ctx, in, out);
        if (!failed && (in.isReadable() || currentArray != null)) {
            int left = in.readableBytes();
            int received = currentArray != null ? currentArray.size() : 0;
            failed = true;
            resetArray();
            in.skipBytes(left);
            throw new CorruptedFrameException("unexpected end of stream inside a frame ("
                    + received + " elements read, " + left + " bytes pending)");
        }
    }

    /**
     * @return false if the buffer ends before the frame does
     */
    private boolean readFrame(ByteBuf in, List<Object> out) {
        if (!in.isReadable()) return false;

        byte type = in.getByte(in.readerIndex());
        switch (type) {
            case Resp.ARRAY:
                in.skipBytes(1);
                return readArray(in, out);
            case Resp.SIMPLE_STRING: {
                in.skipBytes(1);
                byte[] line = readLine(in);
                if (line == null) return false;
                out.add(new Request(Request.Kind.SIMPLE_STRING, List.of(line)));
                return true;
            }
            case Resp.ERROR: {
                in.skipBytes(1);
                byte[] line = readLine(in);
                if (line == null) return false;
                out.add(new Request(Request.Kind.ERROR, List.of(Resp.bytes(Request.ERROR_TAG), line)));
                return true;
            }
            case Resp.INTEGER: {
                in.skipBytes(1);
                byte[] line = readLine(in);
                if (line == null) return false;
                out.add(new Request(Request.Kind.INTEGER, List.of(Resp.bytes(Request.INTEGER_TAG), line)));
                return true;
            }
            case Resp.BULK_STRING: {
                in.skipBytes(1);
                ByteBuf bulk = readBulk(in);
                if (bulk == null) return false;
                out.add(new Request(Request.Kind.BULK_STRING, List.of(toBytes(bulk))));
                return true;
            }
            default:
                // Inline command: the first byte belongs to the line
                return readInline(in, out);
        }
    }

    private boolean readArray(ByteBuf in, List<Object> out) {
        byte[] header = readLine(in);
        if (header == null) return false;
        int count = (int) parseInteger(header, "multibulk length", Integer.MIN_VALUE, Integer.MAX_VALUE);
        if (count <= 0) {
            // Empty or null array: consumed, nothing to dispatch
            return true;
        }
        if (count > maxMultibulkLength) {
            throw new CorruptedFrameException("invalid multibulk length: " + count);
        }
        multiBulkLength = count;
        currentArray = new ArrayList<>(Math.min(count, 1024));
        return readElements(in, out);
    }

    /**
     * Continues the array in progress. On a short buffer the reader index is
     * left at the start of the unfinished element, or after its header once
     * the header has been read.
     */
    private boolean readElements(ByteBuf in, List<Object> out) {
        while (currentArray.size() < multiBulkLength) {
            if (pendingBulkLength < 0) {
                if (!in.isReadable()) return false;
                int mark = in.readerIndex();
                byte marker = in.readByte();
                if (marker != Resp.BULK_STRING) {
                    throw new CorruptedFrameException("expected '$' in multibulk, got '" + printable(marker) + "'");
                }
                byte[] header = readLine(in);
                if (header == null) {
                    in.readerIndex(mark);
                    return false;
                }
                long length = parseInteger(header, "bulk length", -1, maxBulkLength);
                if (length == -1) {
                    currentArray.add(EMPTY);
                    continue;
                }
                pendingBulkLength = (int) length;
            }
            if (in.readableBytes() < pendingBulkLength + 2) return false;

            byte[] payload = pendingBulkLength == 0 ? EMPTY : new byte[pendingBulkLength];
            in.readBytes(payload);
            if (in.readByte() != '\r' || in.readByte() != '\n') {
                throw new CorruptedFrameException("expected CRLF after bulk string");
            }
            pendingBulkLength = -1;
            currentArray.add(payload);
        }

        List<byte[]> args = currentArray;
        resetArray();
        out.add(new Request(Request.Kind.ARRAY, args));
        return true;
    }

    private void resetArray() {
        currentArray = null;
        multiBulkLength = 0;
        pendingBulkLength = -1;
    }

    /**
     * Reads {@code <length>\r\n<payload>\r\n} (marker already consumed).
     *
     * @return the payload, an empty buffer for a null bulk, or null if incomplete
     */
    private ByteBuf readBulk(ByteBuf in) {
        byte[] header = readLine(in);
        if (header == null) return null;
        long length = parseInteger(header, "bulk length", -1, maxBulkLength);
        if (length == -1) {
            return in.slice(in.readerIndex(), 0);
        }
        int len = (int) length;
        if (in.readableBytes() < len + 2) return null;

        ByteBuf payload = in.slice(in.readerIndex(), len);
        in.skipBytes(len);
        if (in.readByte() != '\r' || in.readByte() != '\n') {
            throw new CorruptedFrameException("expected CRLF after bulk string");
        }
        return payload;
    }

    /**
     * Reads one CRLF-terminated line, without the terminator.
     *
     * @return the line, or null if no terminator is buffered yet
     */
    private byte[] readLine(ByteBuf in) {
        int lf = in.indexOf(in.readerIndex(), in.writerIndex(), (byte) '\n');
        if (lf < 0) {
            if (in.readableBytes() > maxInlineLength) {
                throw new CorruptedFrameException("line too long");
            }
            return null;
        }
        int length = lf - in.readerIndex();
        if (length == 0 || in.getByte(lf - 1) != '\r') {
            throw new CorruptedFrameException("expected CRLF line terminator");
        }
        if (length - 1 > maxInlineLength) {
            throw new CorruptedFrameException("line too long");
        }
        byte[] line = new byte[length - 1];
        in.readBytes(line);
        in.skipBytes(2);
        return line;
    }

    private boolean readInline(ByteBuf in, List<Object> out) {
        int lf = in.indexOf(in.readerIndex(), in.writerIndex(), (byte) '\n');
        if (lf < 0) {
            if (in.readableBytes() > maxInlineLength) {
                throw new CorruptedFrameException("too big inline request");
            }
            return false;
        }
        int length = lf - in.readerIndex();
        if (length > maxInlineLength) {
            throw new CorruptedFrameException("too big inline request");
        }
        byte[] line = new byte[length];
        in.readBytes(line);
        in.skipBytes(1);

        List<byte[]> tokens = splitWhitespace(line);
        if (tokens.isEmpty()) {
            throw new CorruptedFrameException("empty inline command");
        }
        out.add(new Request(Request.Kind.INLINE, tokens));
        return true;
    }

    static List<byte[]> splitWhitespace(byte[] line) {
        List<byte[]> tokens = new ArrayList<>();
        int i = 0;
        while (i < line.length) {
            while (i < line.length && isWhitespace(line[i])) i++;
            int start = i;
            while (i < line.length && !isWhitespace(line[i])) i++;
            if (i > start) {
                byte[] token = new byte[i - start];
                System.arraycopy(line, start, token, 0, token.length);
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static boolean isWhitespace(byte b) {
        return b == ' ' || b == '\t' || b == '\r' || b == '\n' || b == 0x0B || b == '\f';
    }

    /**
     * Parses an optionally negative decimal. No sign other than '-', no
     * blanks, no leading '+'.
     */
    static long parseInteger(byte[] digits, String what, long min, long max) {
        if (digits.length == 0 || digits.length > 20) {
            throw new CorruptedFrameException("invalid " + what);
        }
        int i = 0;
        boolean negative = digits[0] == '-';
        if (negative) {
            i = 1;
            if (digits.length == 1) throw new CorruptedFrameException("invalid " + what);
        }
        long value = 0;
        for (; i < digits.length; i++) {
            byte b = digits[i];
            if (b < '0' || b > '9') {
                throw new CorruptedFrameException("invalid " + what + ": '" + Resp.text(digits) + "'");
            }
            value = value * 10 + (b - '0');
            if (value > Integer.MAX_VALUE + 1L) {
                throw new CorruptedFrameException("invalid " + what + ": out of range");
            }
        }
        if (negative) value = -value;
        if (value < min || value > max) {
            throw new CorruptedFrameException("invalid " + what + ": " + value);
        }
        return value;
    }

    private static byte[] toBytes(ByteBuf buf) {
        if (!buf.isReadable()) return EMPTY;
        byte[] bytes = new byte[buf.readableBytes()];
        buf.getBytes(buf.readerIndex(), bytes);
        return bytes;
    }

    private static char printable(byte b) {
        return b >= 0x20 && b < 0x7F ? (char) b : '?';
    }
}
