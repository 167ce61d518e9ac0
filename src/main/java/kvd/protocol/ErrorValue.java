package kvd.protocol;

import kvd.KvdException;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

public final class ErrorValue extends RespValue {
    private final byte[] bytes;

    ErrorValue(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Builds an error from server-generated text. Line breaks are replaced with spaces,
     * since messages may echo client bytes such as an unknown command name.
     */
    public static ErrorValue of(String message) {
        return new ErrorValue(message.replace('\r', ' ').replace('\n', ' ').getBytes(StandardCharsets.UTF_8));
    }

    public static ErrorValue of(KvdException e) {
        return of(e.toErrorMessage());
    }

    @Override
    public RespType getType() {
        return RespType.ERROR;
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    byte[] rawBytes() {
        return bytes;
    }

    /** Lossy text view, convenient for logs and assertions. */
    public String getMessage() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public String asUtf8() throws EncodingException {
        return decodeUtf8(bytes, "error");
    }

    @Override
    public int estimatedSize() {
        return bytes.length + 3;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ErrorValue && Arrays.equals(bytes, ((ErrorValue) o).bytes);
    }

    @Override
    public int hashCode() {
        return 37 + hashBytes(bytes);
    }

    @Override
    public String toString() {
        return "Error(" + preview(bytes) + ")";
    }
}
