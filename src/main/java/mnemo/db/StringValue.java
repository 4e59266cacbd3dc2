package mnemo.db;

import java.util.Arrays;

public final class StringValue extends Value {
    private final byte[] bytes;

    public StringValue(byte[] bytes) {
        if (bytes == null) throw new IllegalArgumentException("value must not be null");
        this.bytes = bytes.clone();
    }

    @Override
    public DataType type() {
        return DataType.STRING;
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StringValue)) return false;
        return Arrays.equals(bytes, ((StringValue) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }
}
