package kvd.protocol;

/**
 * The five RESP2 value kinds and the marker byte that introduces each on the wire.
 */
public enum RespType {
    SIMPLE_STRING('+'),
    ERROR('-'),
    INTEGER(':'),
    BULK_STRING('$'),
    ARRAY('*');

    private final byte marker;

    RespType(char marker) {
        this.marker = (byte) marker;
    }

    public byte getMarker() {
        return marker;
    }

    /** Returns the type for a leading byte, or {@code null} if the byte is not a RESP marker. */
    public static RespType fromMarker(byte b) {
        switch (b) {
            case '+': return SIMPLE_STRING;
            case '-': return ERROR;
            case ':': return INTEGER;
            case '$': return BULK_STRING;
            case '*': return ARRAY;
            default: return null;
        }
    }
}
