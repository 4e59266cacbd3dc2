package mnemo.db;

/**
 * Kinds of value a key can hold. Only {@link #STRING} has an implementation;
 * the rest are reserved so the set stays closed when they are added.
 */
public enum DataType {
    STRING(true),
    LIST(false),
    SET(false),
    HASH(false),
    SORTED_SET(false);

    private final boolean implemented;

    DataType(boolean implemented) {
        this.implemented = implemented;
    }

    public boolean isImplemented() {
        return implemented;
    }
}
