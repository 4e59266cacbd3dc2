package mnemo.db;

/**
 * Stand-in for a kind that has no implementation yet. It carries no payload.
 * Only reachable through {@link MnemoDatabase#seed(String, Value)}.
 */
public final class ReservedValue extends Value {
    private final DataType type;

    public ReservedValue(DataType type) {
        if (type == null) throw new IllegalArgumentException("type must not be null");
        if (type.isImplemented()) {
            throw new IllegalArgumentException(type + " values have their own implementation");
        }
        this.type = type;
    }

    @Override
    public DataType type() {
        return type;
    }
}
