package kvd.context;

import kvd.utils.Time;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-request deadline and retry budget.
 *
 * <p>A fresh instance is created for every request right before dispatch. Handlers may
 * share it with sub-operations they spawn: the deadline queries are read-only and the
 * retry counter is decremented atomically.
 *
 * <p>The context never cancels anything by itself. Callers poll {@link #checkTimeout()};
 * hard enforcement of the deadline is done by the connection server.
 */
public final class RequestContext {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    public static final int DEFAULT_RETRIES = 3;

    private final Duration timeout;
    private final AtomicLong retries;
    private final long startNanos;

    public RequestContext(Duration timeout, long retries) {
        this.timeout = timeout;
        this.retries = new AtomicLong(retries);
        this.startNanos = Time.nanoTime();
    }

    public static RequestContext withDefaults() {
        return new RequestContext(DEFAULT_TIMEOUT, DEFAULT_RETRIES);
    }

    /** Deadline duration, or {@code null} when the request never times out. */
    public Duration getTimeout() {
        return timeout;
    }

    public long getRetries() {
        return retries.get();
    }

    public Duration elapsed() {
        return Duration.ofNanos(Time.nanoTime() - startNanos);
    }

    /** Time left before the deadline (never negative), or {@code null} without a deadline. */
    public Duration remaining() {
        if (timeout == null) return null;
        Duration left = timeout.minus(elapsed());
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isTimeout() {
        return timeout != null && elapsed().compareTo(timeout) > 0;
    }

    public void checkTimeout() throws TimedOutException {
        if (isTimeout()) {
            throw new TimedOutException(timeout);
        }
    }

    public boolean isRetriable() {
        return retries.get() > 0;
    }

    public void decreaseRetries() throws NoRetriesLeftException {
        long before = retries.getAndDecrement();
        if (before <= 0) {
            throw new NoRetriesLeftException();
        }
    }

    @Override
    public String toString() {
        return "RequestContext{timeout=" + timeout + ", retries=" + retries.get() + ", elapsed=" + elapsed() + "}";
    }
}
