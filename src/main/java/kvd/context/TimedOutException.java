package kvd.context;

import kvd.KvdException;

import java.time.Duration;

public class TimedOutException extends KvdException {
    private final Duration timeout;

    public TimedOutException(Duration timeout) {
        super("Timeout after " + timeout.toMillis() + " ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
