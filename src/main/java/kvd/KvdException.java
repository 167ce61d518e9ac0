package kvd;

/**
 * Base class for failures that are reported back to the client as a RESP error
 * while the connection stays open.
 */
public class KvdException extends Exception {
    public static final String DEFAULT_PREFIX = "ERR";

    private final String errorPrefix;

    public KvdException(String message) {
        this(DEFAULT_PREFIX, message);
    }

    public KvdException(String errorPrefix, String message) {
        super(message);
        this.errorPrefix = errorPrefix;
    }

    public KvdException(String message, Throwable cause) {
        super(message, cause);
        this.errorPrefix = DEFAULT_PREFIX;
    }

    public String getErrorPrefix() {
        return errorPrefix;
    }

    /** Text sent after the '-' marker, e.g. {@code ERR syntax error}. */
    public String toErrorMessage() {
        return errorPrefix + " " + getMessage();
    }
}
