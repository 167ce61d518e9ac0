package kvd.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * One decoded unit of the wire protocol. Instances are immutable: byte payloads are
 * copied when a value is built from caller data and when they are handed back out.
 */
public abstract class RespValue {

    RespValue() {
    }

    public abstract RespType getType();

    /**
     * Upper bound of the encoded size in bytes, used to size the output buffer once
     * per response.
     */
    public abstract int estimatedSize();

    /**
     * Text view of string-like values. Fails for integers, arrays and the null bulk string.
     */
    public String asUtf8() throws EncodingException {
        throw new EncodingException("Invalid type to convert to string: " + getType());
    }

    static String decodeUtf8(byte[] bytes, String what) throws EncodingException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new EncodingException("invalid UTF-8 in " + what);
        }
    }

    static void requireNoLineBreak(byte[] bytes) {
        for (byte b : bytes) {
            if (b == '\r' || b == '\n') {
                throw new IllegalArgumentException("CR/LF not allowed in a line value");
            }
        }
    }

    static String preview(byte[] bytes) {
        if (bytes == null) return "null";
        int n = Math.min(bytes.length, 64);
        String text = new String(bytes, 0, n, StandardCharsets.UTF_8);
        return bytes.length > n ? text + "..." : text;
    }

    static int hashBytes(byte[] bytes) {
        return Arrays.hashCode(bytes);
    }
}
