package mnemo.db;

/**
 * Result of a typed read: the key is absent, holds another kind, or holds
 * the requested kind.
 */
public final class Lookup {

    public enum Status {
        ABSENT,
        WRONG_TYPE,
        FOUND
    }

    private static final Lookup ABSENT = new Lookup(Status.ABSENT, null, null);

    private final Status status;
    private final byte[] value;
    private final DataType actualType;

    private Lookup(Status status, byte[] value, DataType actualType) {
        this.status = status;
        this.value = value;
        this.actualType = actualType;
    }

    public static Lookup absent() {
        return ABSENT;
    }

    public static Lookup wrongType(DataType actualType) {
        return new Lookup(Status.WRONG_TYPE, null, actualType);
    }

    public static Lookup found(byte[] value) {
        return new Lookup(Status.FOUND, value, DataType.STRING);
    }

    public Status getStatus() {
        return status;
    }

    /** False only when the key does not exist. */
    public boolean isFound() {
        return status != Status.ABSENT;
    }

    /** False only when the key exists with a different kind. */
    public boolean isTypeOk() {
        return status != Status.WRONG_TYPE;
    }

    /**
     * The stored bytes; only valid when the status is {@link Status#FOUND}.
     */
    public byte[] getValue() {
        if (status != Status.FOUND) {
            throw new IllegalStateException("No value for lookup status " + status);
        }
        return value;
    }

    @Override
    public String toString() {
        return "Lookup{" + status + (actualType != null ? ", " + actualType : "") + "}";
    }
}
