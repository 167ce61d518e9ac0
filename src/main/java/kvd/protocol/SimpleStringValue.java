package kvd.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

public final class SimpleStringValue extends RespValue {
    public static final SimpleStringValue OK = of("OK");
    public static final SimpleStringValue PONG = of("PONG");

    private final byte[] bytes;

    SimpleStringValue(byte[] bytes) {
        this.bytes = bytes;
    }

    public static SimpleStringValue of(String text) {
        return of(text.getBytes(StandardCharsets.UTF_8));
    }

    public static SimpleStringValue of(byte[] bytes) {
        requireNoLineBreak(bytes);
        return new SimpleStringValue(bytes.clone());
    }

    @Override
    public RespType getType() {
        return RespType.SIMPLE_STRING;
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    byte[] rawBytes() {
        return bytes;
    }

    @Override
    public String asUtf8() throws EncodingException {
        return decodeUtf8(bytes, "simple string");
    }

    @Override
    public int estimatedSize() {
        return bytes.length + 3;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SimpleStringValue && Arrays.equals(bytes, ((SimpleStringValue) o).bytes);
    }

    @Override
    public int hashCode() {
        return 31 + hashBytes(bytes);
    }

    @Override
    public String toString() {
        return "SimpleString(" + preview(bytes) + ")";
    }
}
