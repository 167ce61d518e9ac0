package kvd.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Incremental RESP2 decoder. Emits one {@link RespValue} per top-level value.
 *
 * <p>State survives between reads, so a value may arrive split at any byte boundary.
 * Arrays are assembled on an explicit stack instead of by recursion; the stack height is
 * the nesting depth and is capped by {@code maxNestingDepth}.
 *
 * <p>Malformed input raises {@link ProtocolException}. After that the decoder discards
 * everything it receives, the owning handler is expected to close the channel.
 */
public class RespDecoder extends ByteToMessageDecoder {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 128;
    public static final int DEFAULT_MAX_BULK_LENGTH = 512 * 1024 * 1024;
    public static final int DEFAULT_MAX_ARRAY_LENGTH = 1024 * 1024;
    public static final int DEFAULT_MAX_LINE_LENGTH = 64 * 1024;
    // payload plus CRLF must fit in one byte[] and in an int
    public static final int MAX_BULK_LENGTH_LIMIT = Integer.MAX_VALUE - 8;

    private enum State {
        READ_HEADER,
        READ_BULK_CONTENT,
        FAILED
    }

    private static final class PendingArray {
        final int expected;
        final List<RespValue> elements;

        PendingArray(int expected) {
            this.expected = expected;
            this.elements = new ArrayList<>(Math.min(expected, 1024));
        }

        boolean isComplete() {
            return elements.size() == expected;
        }
    }

    private final int maxNestingDepth;
    private final int maxBulkLength;
    private final int maxArrayLength;
    private final int maxLineLength;

    private State state = State.READ_HEADER;
    private final Deque<PendingArray> pending = new ArrayDeque<>();
    private int bulkLength;

    public RespDecoder() {
        this(DEFAULT_MAX_NESTING_DEPTH, DEFAULT_MAX_BULK_LENGTH, DEFAULT_MAX_ARRAY_LENGTH, DEFAULT_MAX_LINE_LENGTH);
    }

    public RespDecoder(int maxNestingDepth, int maxBulkLength, int maxArrayLength, int maxLineLength) {
        if (maxNestingDepth < 1) throw new IllegalArgumentException("maxNestingDepth must be >= 1");
        if (maxBulkLength < 0 || maxBulkLength > MAX_BULK_LENGTH_LIMIT) {
            throw new IllegalArgumentException("maxBulkLength must be between 0 and " + MAX_BULK_LENGTH_LIMIT);
        }
        this.maxNestingDepth = maxNestingDepth;
        this.maxBulkLength = maxBulkLength;
        this.maxArrayLength = maxArrayLength;
        this.maxLineLength = maxLineLength;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        if (state == State.FAILED) {
            in.skipBytes(in.readableBytes());
            return;
        }
        try {
            decodeAvailable(in, out);
        } catch (ProtocolException e) {
            state = State.FAILED;
            pending.clear();
            in.skipBytes(in.readableBytes());
            throw e;
        }
    }

    private void decodeAvailable(ByteBuf in, List<Object> out) {
        while (true) {
            RespValue complete;

            if (state == State.READ_HEADER) {
                int start = in.readerIndex();
                int searchEnd = Math.min(in.writerIndex(), start + maxLineLength + 2);
                int eol = in.indexOf(start, searchEnd, (byte) '\n');
                if (eol == -1) {
                    if (in.readableBytes() > maxLineLength + 1) {
                        throw new ProtocolException("Invalid line: longer than " + maxLineLength + " bytes");
                    }
                    return; // Wait for more data
                }

                int lineLength = eol - start + 1;
                if (lineLength < 3 || in.getByte(eol - 1) != '\r') {
                    throw new ProtocolException("Invalid line " + quote(in, start, lineLength));
                }

                byte marker = in.getByte(start);
                RespType type = RespType.fromMarker(marker);
                if (type == null) {
                    throw new ProtocolException("Invalid character: " + (marker & 0xFF));
                }

                int contentStart = start + 1;
                int contentLength = lineLength - 3;
                complete = null;

                switch (type) {
                    case SIMPLE_STRING:
                        complete = new SimpleStringValue(copy(in, contentStart, contentLength));
                        break;
                    case ERROR:
                        complete = new ErrorValue(copy(in, contentStart, contentLength));
                        break;
                    case INTEGER:
                        complete = IntegerValue.of(parseLong(in, contentStart, contentLength));
                        break;
                    case BULK_STRING: {
                        long len = parseLong(in, contentStart, contentLength);
                        if (len == -1) {
                            complete = BulkStringValue.NULL;
                        } else if (len < -1 || len > maxBulkLength) {
                            throw new ProtocolException("Invalid bulk length " + len);
                        } else {
                            bulkLength = (int) len;
                            state = State.READ_BULK_CONTENT;
                        }
                        break;
                    }
                    case ARRAY: {
                        long count = parseLong(in, contentStart, contentLength);
                        if (count < 0 || count > maxArrayLength) {
                            throw new ProtocolException("Invalid array length " + count);
                        }
                        if (count == 0) {
                            complete = ArrayValue.EMPTY;
                        } else {
                            if (pending.size() >= maxNestingDepth) {
                                throw new NestingTooDeepException(maxNestingDepth);
                            }
                            pending.push(new PendingArray((int) count));
                        }
                        break;
                    }
                }

                in.readerIndex(eol + 1);
                if (complete == null) {
                    continue; // Bulk payload or array elements follow
                }
            } else {
                // Payload plus the trailing CRLF
                if (in.readableBytes() < (long) bulkLength + 2) return;

                byte[] payload = new byte[bulkLength];
                in.readBytes(payload);
                if (in.readByte() != '\r' || in.readByte() != '\n') {
                    throw new ProtocolException("Bulk string of length " + bulkLength + " not terminated by CRLF");
                }
                complete = payload.length == 0 ? BulkStringValue.EMPTY : new BulkStringValue(payload);
                state = State.READ_HEADER;
            }

            if (attach(complete, out)) {
                return; // Emitted one top-level value
            }
        }
    }

    /**
     * Adds a finished value to the innermost open array, closing arrays that become full.
     * Returns true once a top-level value has been emitted.
     */
    private boolean attach(RespValue value, List<Object> out) {
        RespValue complete = value;
        while (true) {
            PendingArray top = pending.peek();
            if (top == null) {
                out.add(complete);
                return true;
            }
            top.elements.add(complete);
            if (!top.isComplete()) {
                return false;
            }
            pending.pop();
            complete = ArrayValue.wrap(top.elements);
        }
    }

    private static byte[] copy(ByteBuf in, int index, int length) {
        byte[] bytes = new byte[length];
        in.getBytes(index, bytes);
        return bytes;
    }

    private static long parseLong(ByteBuf in, int index, int length) {
        if (length == 0) {
            throw new ProtocolException("Invalid number: empty");
        }
        int i = index;
        int end = index + length;
        boolean negative = false;
        if (in.getByte(i) == '-') {
            negative = true;
            i++;
        } else if (in.getByte(i) == '+') {
            i++;
        }
        if (i == end || end - i > 19) {
            throw new ProtocolException("Invalid number " + quote(in, index, length));
        }
        long result = 0;
        for (; i < end; i++) {
            byte b = in.getByte(i);
            if (b < '0' || b > '9') {
                throw new ProtocolException("Invalid number " + quote(in, index, length));
            }
            try {
                // accumulate negatively so Long.MIN_VALUE stays representable
                result = Math.subtractExact(Math.multiplyExact(result, 10L), b - '0');
            } catch (ArithmeticException e) {
                throw new ProtocolException("Number out of range " + quote(in, index, length));
            }
        }
        if (!negative) {
            if (result == Long.MIN_VALUE) {
                throw new ProtocolException("Number out of range " + quote(in, index, length));
            }
            result = -result;
        }
        return result;
    }

    private static String quote(ByteBuf in, int index, int length) {
        int n = Math.min(length, 32);
        String text = in.toString(index, n, StandardCharsets.UTF_8)
                .replace("\r", "\\r").replace("\n", "\\n");
        return "\"" + text + (length > n ? "...\"" : "\"");
    }
}
