package kvd.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import net.jqwik.api.*;

import static org.junit.jupiter.api.Assertions.*;

public class RespParserPropertyTest {

    @Property
    void parsingShouldNotCrash(@ForAll byte[] bytes) {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        try {
            channel.writeInbound(Unpooled.wrappedBuffer(bytes));
        } catch (ProtocolException expected) {
            // malformed input is reported, anything else fails the property
        }
    }

    @Property
    void encodedValuesDecodeToThemselves(@ForAll("values") RespValue value) {
        ByteBuf buf = Unpooled.buffer();
        RespEncoder.write(value, buf);

        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());
        channel.writeInbound(buf);
        assertEquals(value, channel.readInbound());
        assertNull(channel.readInbound());
    }

    @Property
    void encodedSizeNeverExceedsEstimate(@ForAll("values") RespValue value) {
        ByteBuf buf = Unpooled.buffer();
        RespEncoder.write(value, buf);
        assertTrue(buf.readableBytes() <= value.estimatedSize());
    }

    @Provide
    Arbitrary<RespValue> values() {
        return value();
    }

    private Arbitrary<RespValue> value() {
        return Arbitraries.lazyOf(this::scalar, this::scalar, this::scalar, this::array);
    }

    private Arbitrary<RespValue> array() {
        return value().list().ofMaxSize(4).map(list -> (RespValue) ArrayValue.of(list));
    }

    private Arbitrary<RespValue> scalar() {
        Arbitrary<String> line = Arbitraries.strings().ofMaxLength(20).excludeChars('\r', '\n');
        return Arbitraries.oneOf(
                line.map(s -> (RespValue) SimpleStringValue.of(s)),
                line.map(s -> (RespValue) ErrorValue.of(s)),
                Arbitraries.longs().map(n -> (RespValue) IntegerValue.of(n)),
                Arbitraries.bytes().array(byte[].class).ofMaxSize(64).injectNull(0.1)
                        .map(b -> (RespValue) BulkStringValue.of(b)));
    }
}
