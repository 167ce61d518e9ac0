package kvd.protocol;

import kvd.KvdException;

/**
 * Raised when bytes that must be read as text (command names, keys, option tokens)
 * are not valid UTF-8, or when a value of the wrong kind is read as text.
 */
public class EncodingException extends KvdException {
    public EncodingException(String message) {
        super(message);
    }
}
