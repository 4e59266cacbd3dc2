package mnemo.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A typed reply, serialized by {@link Resp}.
 */
public abstract class Reply {

    public enum Kind {
        STATUS,
        ERROR,
        INTEGER,
        BULK,
        ARRAY
    }

    private static final Reply OK = new Status("OK");
    private static final Reply NULL_BULK = new Bulk(null);

    public abstract Kind kind();

    public abstract byte[] encode();

    public static Reply ok() {
        return OK;
    }

    public static Reply status(String text) {
        return new Status(singleLine(text));
    }

    public static Reply error(String message) {
        return new ErrorLine(singleLine(message));
    }

    public static Reply integer(long value) {
        return new Int(value);
    }

    public static Reply bulk(byte[] payload) {
        return payload == null ? NULL_BULK : new Bulk(payload.clone());
    }

    public static Reply nullBulk() {
        return NULL_BULK;
    }

    public static Reply array(List<byte[]> elements) {
        return new Array(elements);
    }

    // Status and error lines are CRLF-terminated, so they cannot carry CR or LF.
    static String singleLine(String s) {
        if (s.indexOf('\r') < 0 && s.indexOf('\n') < 0) return s;
        return s.replace('\r', ' ').replace('\n', ' ');
    }

    static final class Status extends Reply {
        final String text;

        Status(String text) {
            this.text = text;
        }

        @Override
        public Kind kind() {
            return Kind.STATUS;
        }

        @Override
        public byte[] encode() {
            return Resp.simpleString(text);
        }

        @Override
        public String toString() {
            return "+" + text;
        }
    }

    static final class ErrorLine extends Reply {
        final String message;

        ErrorLine(String message) {
            this.message = message;
        }

        @Override
        public Kind kind() {
            return Kind.ERROR;
        }

        @Override
        public byte[] encode() {
            return Resp.error(message);
        }

        @Override
        public String toString() {
            return "-" + message;
        }
    }

    static final class Int extends Reply {
        final long value;

        Int(long value) {
            this.value = value;
        }

        @Override
        public Kind kind() {
            return Kind.INTEGER;
        }

        @Override
        public byte[] encode() {
            return Resp.integer(value);
        }

        @Override
        public String toString() {
            return ":" + value;
        }
    }

    static final class Bulk extends Reply {
        final byte[] payload;

        Bulk(byte[] payload) {
            this.payload = payload;
        }

        @Override
        public Kind kind() {
            return Kind.BULK;
        }

        @Override
        public byte[] encode() {
            return Resp.bulkString(payload);
        }

        @Override
        public String toString() {
            return payload == null ? "(nil)" : "\"" + Resp.text(payload) + "\"";
        }
    }

    static final class Array extends Reply {
        final List<byte[]> elements;

        Array(List<byte[]> elements) {
            this.elements = elements == null ? null : Collections.unmodifiableList(new ArrayList<>(elements));
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY;
        }

        @Override
        public byte[] encode() {
            return Resp.array(elements);
        }

        @Override
        public String toString() {
            return elements == null ? "*(nil)" : "*" + elements.size();
        }
    }
}
