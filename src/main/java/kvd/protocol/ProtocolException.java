package kvd.protocol;

import io.netty.handler.codec.DecoderException;

/**
 * Malformed wire data. The stream is desynchronized after this, so the connection
 * that produced it has to be closed.
 */
public class ProtocolException extends DecoderException {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
