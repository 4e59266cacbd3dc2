package mnemo.db;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The keyspace. Every operation is atomic with respect to every other: reads
 * share the read lock, mutations take the write lock for the whole call.
 * The backing map never escapes this class.
 */
public class MnemoDatabase {
    public static final String OK = "OK";

    private final Map<String, ValueEntry> store = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Reads a string value.
     */
    public Lookup get(String key) {
        lock.readLock().lock();
        try {
            ValueEntry entry = store.get(key);
            if (entry == null) {
                return Lookup.absent();
            }
            Value value = entry.getValue();
            if (!(value instanceof StringValue)) {
                return Lookup.wrongType(value.type());
            }
            return Lookup.found(((StringValue) value).getBytes());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Creates or overwrites {@code key} as a string with no expiry.
     *
     * @return always {@link #OK}
     */
    public String set(String key, byte[] value) {
        ValueEntry entry = new ValueEntry(new StringValue(value));
        lock.writeLock().lock();
        try {
            store.put(key, entry);
        } finally {
            lock.writeLock().unlock();
        }
        return OK;
    }

    /**
     * Removes the given keys.
     *
     * @return how many of them existed before the call
     */
    public int delete(String... keys) {
        lock.writeLock().lock();
        try {
            int removed = 0;
            for (String key : keys) {
                if (store.remove(key) != null) {
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<DataType> typeOf(String key) {
        lock.readLock().lock();
        try {
            ValueEntry entry = store.get(key);
            return entry == null ? Optional.empty() : Optional.of(entry.getType());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stores an entry of any kind. Commands never call this; it exists so
     * tests can plant values of the reserved kinds.
     */
    public void seed(String key, Value value) {
        ValueEntry entry = new ValueEntry(value);
        lock.writeLock().lock();
        try {
            store.put(key, entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return store.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            store.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
