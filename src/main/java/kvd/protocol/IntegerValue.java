package kvd.protocol;

public final class IntegerValue extends RespValue {
    // sign plus 19 digits of a long, marker and CRLF fit well inside this
    private static final int MAX_ENCODED_SIZE = 32;

    private final long value;

    private IntegerValue(long value) {
        this.value = value;
    }

    public static IntegerValue of(long value) {
        return new IntegerValue(value);
    }

    @Override
    public RespType getType() {
        return RespType.INTEGER;
    }

    public long getValue() {
        return value;
    }

    @Override
    public int estimatedSize() {
        return MAX_ENCODED_SIZE;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IntegerValue && value == ((IntegerValue) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "Integer(" + value + ")";
    }
}
