package kvd.db;

/**
 * A stored value with its optional absolute expiry (epoch millis, -1 for none).
 * Entries are replaced, never mutated.
 */
public final class ValueEntry {
    public static final long NO_EXPIRY = -1;

    private final byte[] value;
    private final long expireAt;

    public ValueEntry(byte[] value, long expireAt) {
        this.value = value;
        this.expireAt = expireAt;
    }

    public byte[] getValue() {
        return value;
    }

    public long getExpireAt() {
        return expireAt;
    }

    public boolean hasExpiry() {
        return expireAt != NO_EXPIRY;
    }

    public boolean isExpired(long now) {
        return expireAt != NO_EXPIRY && now >= expireAt;
    }
}
