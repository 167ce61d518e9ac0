package kvd.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Length-prefixed, binary-safe string. {@link #NULL} is the protocol's null bulk string and
 * is distinct from the empty string.
 */
public final class BulkStringValue extends RespValue {
    public static final BulkStringValue NULL = new BulkStringValue(null);
    public static final BulkStringValue EMPTY = new BulkStringValue(new byte[0]);

    // "$" + up to 10 length digits + 2 CRLF pairs
    private static final int HEADER_OVERHEAD = 16;

    private final byte[] bytes;

    BulkStringValue(byte[] bytes) {
        this.bytes = bytes;
    }

    public static BulkStringValue of(byte[] bytes) {
        if (bytes == null) return NULL;
        return new BulkStringValue(bytes.clone());
    }

    public static BulkStringValue of(String text) {
        if (text == null) return NULL;
        return new BulkStringValue(text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public RespType getType() {
        return RespType.BULK_STRING;
    }

    public boolean isNull() {
        return bytes == null;
    }

    /** Copy of the payload, or {@code null} for the null bulk string. */
    public byte[] getBytes() {
        return bytes == null ? null : bytes.clone();
    }

    byte[] rawBytes() {
        return bytes;
    }

    public int length() {
        return bytes == null ? -1 : bytes.length;
    }

    @Override
    public String asUtf8() throws EncodingException {
        if (bytes == null) {
            throw new EncodingException("Null bulk string is invalid");
        }
        return decodeUtf8(bytes, "bulk string");
    }

    @Override
    public int estimatedSize() {
        return (bytes == null ? 0 : bytes.length) + HEADER_OVERHEAD;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BulkStringValue && Arrays.equals(bytes, ((BulkStringValue) o).bytes);
    }

    @Override
    public int hashCode() {
        return 41 + hashBytes(bytes);
    }

    @Override
    public String toString() {
        return bytes == null ? "BulkString(null)" : "BulkString(" + preview(bytes) + ")";
    }
}
