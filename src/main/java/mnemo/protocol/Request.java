package mnemo.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One decoded frame: the command tokens and the frame kind they came from.
 */
public final class Request {

    public enum Kind {
        ARRAY,
        INLINE,
        SIMPLE_STRING,
        ERROR,
        INTEGER,
        BULK_STRING
    }

    // Tag tokens for frames that carry a typed line rather than a command
    public static final String ERROR_TAG = "ERROR";
    public static final String INTEGER_TAG = "INTEGER";

    private final Kind kind;
    private final List<byte[]> args;

    public Request(Kind kind, List<byte[]> args) {
        this.kind = kind;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public Kind getKind() {
        return kind;
    }

    public List<byte[]> getArgs() {
        return args;
    }

    public boolean isEmpty() {
        return args.isEmpty();
    }

    /** Command name as sent, or null for an empty request. */
    public String getName() {
        return args.isEmpty() ? null : Resp.text(args.get(0));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name()).append('[');
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(Resp.text(args.get(i)));
        }
        return sb.append(']').toString();
    }
}
