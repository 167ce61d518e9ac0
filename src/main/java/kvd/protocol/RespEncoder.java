package kvd.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Encodes {@link RespValue}s into RESP2 bytes.
 *
 * <p>The output buffer is sized from {@link RespValue#estimatedSize()} so a response is
 * written without growing the buffer. Nested arrays are walked with an explicit stack.
 */
@ChannelHandler.Sharable
public class RespEncoder extends MessageToByteEncoder<RespValue> {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    public RespEncoder() {
        super(RespValue.class);
    }

    @Override
    protected ByteBuf allocateBuffer(ChannelHandlerContext ctx, RespValue msg, boolean preferDirect) {
        int capacity = msg.estimatedSize();
        return preferDirect ? ctx.alloc().ioBuffer(capacity) : ctx.alloc().heapBuffer(capacity);
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, RespValue msg, ByteBuf out) {
        write(msg, out);
    }

    /** Writes the wire form of {@code value} to {@code out}. */
    public static void write(RespValue value, ByteBuf out) {
        Deque<Iterator<RespValue>> open = new ArrayDeque<>();
        writeOne(value, out, open);
        while (!open.isEmpty()) {
            Iterator<RespValue> it = open.peek();
            if (!it.hasNext()) {
                open.pop();
                continue;
            }
            writeOne(it.next(), out, open);
        }
    }

    private static void writeOne(RespValue value, ByteBuf out, Deque<Iterator<RespValue>> open) {
        switch (value.getType()) {
            case SIMPLE_STRING:
                writeLine(RespType.SIMPLE_STRING, ((SimpleStringValue) value).rawBytes(), out);
                break;
            case ERROR:
                writeLine(RespType.ERROR, ((ErrorValue) value).rawBytes(), out);
                break;
            case INTEGER:
                out.writeByte(RespType.INTEGER.getMarker());
                writeDecimal(((IntegerValue) value).getValue(), out);
                out.writeBytes(CRLF);
                break;
            case BULK_STRING: {
                byte[] bytes = ((BulkStringValue) value).rawBytes();
                if (bytes == null) {
                    out.writeBytes(NULL_BULK);
                } else {
                    out.writeByte(RespType.BULK_STRING.getMarker());
                    writeDecimal(bytes.length, out);
                    out.writeBytes(CRLF);
                    out.writeBytes(bytes);
                    out.writeBytes(CRLF);
                }
                break;
            }
            case ARRAY: {
                ArrayValue array = (ArrayValue) value;
                out.writeByte(RespType.ARRAY.getMarker());
                writeDecimal(array.size(), out);
                out.writeBytes(CRLF);
                if (array.size() > 0) {
                    open.push(array.getElements().iterator());
                }
                break;
            }
        }
    }

    private static void writeLine(RespType type, byte[] bytes, ByteBuf out) {
        out.writeByte(type.getMarker());
        out.writeBytes(bytes);
        out.writeBytes(CRLF);
    }

    private static void writeDecimal(long n, ByteBuf out) {
        out.writeCharSequence(Long.toString(n), StandardCharsets.US_ASCII);
    }
}
