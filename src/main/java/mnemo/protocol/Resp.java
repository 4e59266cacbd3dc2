package mnemo.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * RESP constants and reply serialization. Protocol text (headers, status and
 * error lines, keys) is ISO-8859-1 so that every byte maps to one char.
 */
public final class Resp {
    public static final char ARRAY = '*';
    public static final char BULK_STRING = '$';
    public static final char SIMPLE_STRING = '+';
    public static final char ERROR = '-';
    public static final char INTEGER = ':';

    public static final Charset CHARSET = StandardCharsets.ISO_8859_1;
    public static final byte[] CRLF = {'\r', '\n'};

    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(CHARSET);
    private static final byte[] NULL_ARRAY = "*-1\r\n".getBytes(CHARSET);

    private Resp() {
    }

    // --- SERIALIZATION ---
    public static byte[] simpleString(String s) {
        return (SIMPLE_STRING + s + "\r\n").getBytes(CHARSET);
    }

    public static byte[] error(String s) {
        return (ERROR + s + "\r\n").getBytes(CHARSET);
    }

    public static byte[] integer(long i) {
        return (INTEGER + Long.toString(i) + "\r\n").getBytes(CHARSET);
    }

    public static byte[] bulkString(byte[] b) {
        if (b == null) return NULL_BULK.clone();
        ByteArrayOutputStream bos = new ByteArrayOutputStream(b.length + 16);
        writeBulk(bos, b);
        return bos.toByteArray();
    }

    public static byte[] array(List<byte[]> list) {
        if (list == null) return NULL_ARRAY.clone();
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        bos.writeBytes((ARRAY + Integer.toString(list.size()) + "\r\n").getBytes(CHARSET));
        for (byte[] b : list) {
            if (b == null) {
                bos.writeBytes(NULL_BULK);
            } else {
                writeBulk(bos, b);
            }
        }
        return bos.toByteArray();
    }

    private static void writeBulk(ByteArrayOutputStream bos, byte[] b) {
        bos.writeBytes((BULK_STRING + Integer.toString(b.length) + "\r\n").getBytes(CHARSET));
        bos.writeBytes(b);
        bos.writeBytes(CRLF);
    }

    // --- TEXT HELPERS ---
    public static String text(byte[] b) {
        return new String(b, CHARSET);
    }

    public static byte[] bytes(String s) {
        return s.getBytes(CHARSET);
    }
}
