package kvd.db;

/**
 * Outcome of {@link Store#set}: whether the write happened and the value the key held
 * before it (null if the key was absent or expired).
 */
public final class SetResult {
    private final boolean applied;
    private final byte[] previous;

    SetResult(boolean applied, byte[] previous) {
        this.applied = applied;
        this.previous = previous;
    }

    public boolean isApplied() {
        return applied;
    }

    public byte[] getPrevious() {
        return previous;
    }
}
