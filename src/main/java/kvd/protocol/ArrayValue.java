package kvd.protocol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class ArrayValue extends RespValue {
    public static final ArrayValue EMPTY = new ArrayValue(Collections.emptyList());

    // "*" + up to 10 count digits + CRLF
    private static final int HEADER_OVERHEAD = 13;

    private final List<RespValue> elements;

    private ArrayValue(List<RespValue> elements) {
        this.elements = elements;
    }

    public static ArrayValue of(List<? extends RespValue> elements) {
        for (RespValue v : elements) {
            if (v == null) throw new IllegalArgumentException("array elements must not be null");
        }
        return new ArrayValue(Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    public static ArrayValue of(RespValue... elements) {
        return of(Arrays.asList(elements));
    }

    /** Builds a command-style array of bulk strings. */
    public static ArrayValue ofBulkStrings(String... parts) {
        List<RespValue> list = new ArrayList<>(parts.length);
        for (String part : parts) {
            list.add(BulkStringValue.of(part));
        }
        return new ArrayValue(Collections.unmodifiableList(list));
    }

    // decoder hand-off; the list is already private to the caller
    static ArrayValue wrap(List<RespValue> elements) {
        return elements.isEmpty() ? EMPTY : new ArrayValue(Collections.unmodifiableList(elements));
    }

    @Override
    public RespType getType() {
        return RespType.ARRAY;
    }

    public List<RespValue> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public RespValue get(int index) {
        return elements.get(index);
    }

    @Override
    public int estimatedSize() {
        long len = HEADER_OVERHEAD;
        for (RespValue v : elements) {
            len += v.estimatedSize();
        }
        return (int) Math.min(len, Integer.MAX_VALUE);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ArrayValue && elements.equals(((ArrayValue) o).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return "Array" + elements;
    }
}
