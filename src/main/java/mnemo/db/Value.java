package mnemo.db;

/**
 * Payload of a stored entry, tagged with its kind.
 */
public abstract class Value {

    Value() {
        // variants live in this package
    }

    public abstract DataType type();
}
