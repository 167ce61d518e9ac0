package kvd.commands.string;

import kvd.commands.WrongArgNumberException;
import kvd.context.RequestContext;
import kvd.db.Store;
import kvd.protocol.BulkStringValue;
import kvd.protocol.EncodingException;
import kvd.protocol.RespRequest;
import kvd.protocol.ArrayValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class GetCommandTest {

    private Store store;
    private GetCommand cmd;

    @BeforeEach
    public void setup() {
        store = new Store();
        cmd = new GetCommand(store);
    }

    @Test
    public void testGetExisting() throws Exception {
        store.set("k", "hello".getBytes(StandardCharsets.UTF_8));
        assertEquals(BulkStringValue.of("hello"), cmd.execute(RequestContext.withDefaults(), RespRequest.of("GET", "k")));
    }

    @Test
    public void testGetMissingIsNullBulk() throws Exception {
        assertEquals(BulkStringValue.NULL, cmd.execute(RequestContext.withDefaults(), RespRequest.of("GET", "nope")));
    }

    @Test
    public void testEmptyValueIsNotNull() throws Exception {
        store.set("empty", new byte[0]);
        BulkStringValue reply = (BulkStringValue) cmd.execute(RequestContext.withDefaults(), RespRequest.of("GET", "empty"));
        assertFalse(reply.isNull());
        assertEquals(0, reply.length());
    }

    @Test
    public void testBinaryValue() throws Exception {
        byte[] raw = {0, (byte) 0xFF, '\r', '\n'};
        store.set("bin", raw);
        BulkStringValue reply = (BulkStringValue) cmd.execute(RequestContext.withDefaults(), RespRequest.of("GET", "bin"));
        assertArrayEquals(raw, reply.getBytes());
    }

    @Test
    public void testWrongArgumentCount() {
        assertThrows(WrongArgNumberException.class, () -> cmd.execute(RequestContext.withDefaults(), RespRequest.of("GET")));
        assertThrows(WrongArgNumberException.class, () -> cmd.execute(RequestContext.withDefaults(), RespRequest.of("GET", "a", "b")));
    }

    @Test
    public void testNonUtf8Key() {
        RespRequest req = RespRequest.fromValue(ArrayValue.of(BulkStringValue.of("GET"), BulkStringValue.of(new byte[]{(byte) 0xFE})));
        assertThrows(EncodingException.class, () -> cmd.execute(RequestContext.withDefaults(), req));
    }
}
