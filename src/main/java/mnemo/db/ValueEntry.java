package mnemo.db;

public class ValueEntry {
    public static final long NO_EXPIRY = -1;

    private final Value value;
    private final long expireAt;

    public ValueEntry(Value value, long expireAt) {
        if (value == null) throw new IllegalArgumentException("value must not be null");
        this.value = value;
        this.expireAt = expireAt;
    }

    public ValueEntry(Value value) {
        this(value, NO_EXPIRY);
    }

    public Value getValue() {
        return value;
    }

    public DataType getType() {
        return value.type();
    }

    // Stored but not enforced: nothing reaps expired keys yet.
    public long getExpireAt() {
        return expireAt;
    }

    public boolean hasExpiry() {
        return expireAt != NO_EXPIRY;
    }
}
