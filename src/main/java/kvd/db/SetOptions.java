package kvd.db;

/**
 * Conditions and expiry handling for {@link Store#set}.
 */
public final class SetOptions {

    public enum Condition {
        ALWAYS,
        /** Only set if the key does not exist. */
        NX,
        /** Only set if the key already exists. */
        XX
    }

    public enum ExpiryMode {
        /** Drop any TTL the key had. */
        CLEAR,
        /** Keep the TTL the key had. */
        KEEP,
        /** Expire at {@link #getExpireAt()}. */
        DEADLINE
    }

    public static final SetOptions DEFAULT = new SetOptions(Condition.ALWAYS, ExpiryMode.CLEAR, ValueEntry.NO_EXPIRY);

    private final Condition condition;
    private final ExpiryMode expiryMode;
    private final long expireAt;

    private SetOptions(Condition condition, ExpiryMode expiryMode, long expireAt) {
        this.condition = condition;
        this.expiryMode = expiryMode;
        this.expireAt = expireAt;
    }

    public static SetOptions of(Condition condition, ExpiryMode expiryMode, long expireAt) {
        if (expiryMode == ExpiryMode.DEADLINE && expireAt < 0) {
            throw new IllegalArgumentException("DEADLINE needs an absolute expiry time");
        }
        return new SetOptions(condition, expiryMode, expiryMode == ExpiryMode.DEADLINE ? expireAt : ValueEntry.NO_EXPIRY);
    }

    public Condition getCondition() {
        return condition;
    }

    public ExpiryMode getExpiryMode() {
        return expiryMode;
    }

    public long getExpireAt() {
        return expireAt;
    }
}
