package kvd.db;

import kvd.utils.Time;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The keyspace: string keys to binary values, guarded by a single read/write lock.
 *
 * <p>Every access goes through the lock. Readers share it; a writer excludes everyone.
 * With the default non-fair lock a steady stream of readers can delay a waiting writer;
 * a fair lock hands out the lock roughly in arrival order at some throughput cost.
 *
 * <p>Expired keys are invisible to readers. They are physically removed either on the
 * next access (lazy) or by {@link #purgeExpired(int)} (active).
 */
public class Store {
    private final Map<String, ValueEntry> entries = new HashMap<>();
    private final ReentrantReadWriteLock lock;

    public Store() {
        this(false);
    }

    public Store(boolean fair) {
        this.lock = new ReentrantReadWriteLock(fair);
    }

    /** Copy of the live value for {@code key}, or null if absent or expired. */
    public byte[] get(String key) {
        ValueEntry entry;
        lock.readLock().lock();
        try {
            entry = entries.get(key);
        } finally {
            lock.readLock().unlock();
        }
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(Time.now())) {
            removeIfSame(key, entry);
            return null;
        }
        return entry.getValue().clone();
    }

    public boolean exists(String key) {
        return get(key) != null;
    }

    /**
     * Writes {@code value} under {@code key} as one indivisible operation: the NX/XX check,
     * the capture of the previous value and the write all happen under the write lock.
     */
    public SetResult set(String key, byte[] value, SetOptions options) {
        byte[] stored = value.clone();
        lock.writeLock().lock();
        try {
            long now = Time.now();
            ValueEntry current = entries.get(key);
            if (current != null && current.isExpired(now)) {
                entries.remove(key);
                current = null;
            }
            byte[] previous = current == null ? null : current.getValue().clone();

            if (options.getCondition() == SetOptions.Condition.NX && current != null
                    || options.getCondition() == SetOptions.Condition.XX && current == null) {
                return new SetResult(false, previous);
            }

            long expireAt;
            switch (options.getExpiryMode()) {
                case KEEP:
                    expireAt = current == null ? ValueEntry.NO_EXPIRY : current.getExpireAt();
                    break;
                case DEADLINE:
                    expireAt = options.getExpireAt();
                    break;
                default:
                    expireAt = ValueEntry.NO_EXPIRY;
            }
            entries.put(key, new ValueEntry(stored, expireAt));
            return new SetResult(true, previous);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void set(String key, byte[] value) {
        set(key, value, SetOptions.DEFAULT);
    }

    /**
     * Remaining time to live in milliseconds, -1 if the key has no expiry, -2 if the key
     * does not exist.
     */
    public long ttlMillis(String key) {
        lock.readLock().lock();
        try {
            ValueEntry entry = entries.get(key);
            long now = Time.now();
            if (entry == null || entry.isExpired(now)) return -2;
            if (!entry.hasExpiry()) return -1;
            return entry.getExpireAt() - now;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes up to {@code maxKeys} expired entries and returns how many were removed.
     */
    public int purgeExpired(int maxKeys) {
        int removed = 0;
        lock.writeLock().lock();
        try {
            long now = Time.now();
            Iterator<ValueEntry> it = entries.values().iterator();
            while (it.hasNext() && removed < maxKeys) {
                if (it.next().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return removed;
    }

    /** Number of physically stored entries, expired ones not yet purged included. */
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void removeIfSame(String key, ValueEntry seen) {
        lock.writeLock().lock();
        try {
            entries.remove(key, seen);
        } finally {
            lock.writeLock().unlock();
        }
    }
}
