package kvd.commands.string;

import kvd.commands.CommandException;
import kvd.commands.InvalidIntegerException;
import kvd.commands.SyntaxException;
import kvd.commands.WrongArgNumberException;
import kvd.commands.WrongTypeException;
import kvd.context.RequestContext;
import kvd.context.TimedOutException;
import kvd.db.SetOptions;
import kvd.db.Store;
import kvd.protocol.ArrayValue;
import kvd.protocol.BulkStringValue;
import kvd.protocol.IntegerValue;
import kvd.protocol.RespRequest;
import kvd.protocol.RespValue;
import kvd.protocol.SimpleStringValue;
import kvd.utils.MockClock;
import kvd.utils.Time;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class SetCommandTest {

    private Store store;
    private SetCommand cmd;
    private MockClock clock;

    @BeforeEach
    public void setup() {
        clock = new MockClock();
        Time.setClock(clock);
        store = new Store();
        cmd = new SetCommand(store);
    }

    @AfterEach
    public void tearDown() {
        Time.useSystemClock();
    }

    private RespValue set(String... args) throws Exception {
        return cmd.execute(RequestContext.withDefaults(), RespRequest.of("SET", args));
    }

    private String value(String key) {
        byte[] v = store.get(key);
        return v == null ? null : new String(v, StandardCharsets.UTF_8);
    }

    @Test
    public void testPlainSet() throws Exception {
        assertEquals(SimpleStringValue.OK, set("k", "v"));
        assertEquals("v", value("k"));
        assertEquals(-1, store.ttlMillis("k"));
    }

    @Test
    public void testArgumentCombinations() throws Exception {
        assertEquals(SimpleStringValue.OK, set("k", "v", "NX", "EX", "10"));
        assertEquals(10_000, store.ttlMillis("k"));

        assertEquals(BulkStringValue.NULL, set("k", "v2", "NX"));
        assertEquals("v", value("k"));

        assertEquals(SimpleStringValue.OK, set("k", "v3", "xx", "px", "250"));
        assertEquals("v3", value("k"));
        assertEquals(250, store.ttlMillis("k"));
    }

    @Test
    public void testXxOnMissingKey() throws Exception {
        assertEquals(BulkStringValue.NULL, set("missing", "v", "XX"));
        assertNull(value("missing"));
    }

    @Test
    public void testExpiryUnits() throws Exception {
        set("sec", "v", "EX", "2");
        set("ms", "v", "PX", "2");

        clock.advance(2);
        assertNull(value("ms"));
        assertEquals("v", value("sec"));

        clock.advance(1998);
        assertNull(value("sec"));
    }

    @Test
    public void testKeepTtl() throws Exception {
        set("k", "v", "EX", "100");
        clock.advance(1000);
        set("k", "v2", "KEEPTTL");
        assertEquals(99_000, store.ttlMillis("k"));

        set("k", "v3");
        assertEquals(-1, store.ttlMillis("k"));
    }

    @Test
    public void testGetOption() throws Exception {
        assertEquals(BulkStringValue.NULL, set("k", "v1", "GET"));
        assertEquals(BulkStringValue.of("v1"), set("k", "v2", "GET"));
        assertEquals("v2", value("k"));

        // previous value is returned even when NX blocks the write
        assertEquals(BulkStringValue.of("v2"), set("k", "v3", "NX", "GET"));
        assertEquals("v2", value("k"));
    }

    @Test
    public void testInvalidExpiration() {
        CommandException e = assertThrows(CommandException.class, () -> set("k", "v", "EX", "0"));
        assertEquals("ERR invalid expire time in 'set' command", e.toErrorMessage());
        assertThrows(CommandException.class, () -> set("k", "v", "PX", "-5"));
        assertThrows(CommandException.class, () -> set("k", "v", "EX", String.valueOf(Long.MAX_VALUE)));
        assertThrows(InvalidIntegerException.class, () -> set("k", "v", "EX", "ten"));
        assertNull(value("k"));
    }

    @Test
    public void testConflictingOptions() {
        assertThrows(SyntaxException.class, () -> set("k", "v", "NX", "XX"));
        assertThrows(SyntaxException.class, () -> set("k", "v", "EX", "10", "PX", "100"));
        assertThrows(SyntaxException.class, () -> set("k", "v", "EX", "10", "KEEPTTL"));
        assertThrows(SyntaxException.class, () -> set("k", "v", "EX"));
        assertThrows(SyntaxException.class, () -> set("k", "v", "BOGUS"));
        assertNull(value("k"));
    }

    @Test
    public void testWrongArgumentCount() {
        WrongArgNumberException e = assertThrows(WrongArgNumberException.class, () -> set("k"));
        assertEquals("ERR wrong number of arguments for 'set' command", e.toErrorMessage());
    }

    @Test
    public void testIntegerExpiryArgument() throws Exception {
        RespRequest req = RespRequest.fromValue(ArrayValue.of(BulkStringValue.of("SET"),
                BulkStringValue.of("k"), BulkStringValue.of("v"), BulkStringValue.of("PX"), IntegerValue.of(500)));
        assertEquals(SimpleStringValue.OK, cmd.execute(RequestContext.withDefaults(), req));
        assertEquals(500, store.ttlMillis("k"));
    }

    @Test
    public void testNonStringValueIsWrongType() {
        RespRequest req = RespRequest.fromValue(ArrayValue.of(BulkStringValue.of("SET"),
                BulkStringValue.of("k"), IntegerValue.of(1)));
        assertThrows(WrongTypeException.class, () -> cmd.execute(RequestContext.withDefaults(), req));
    }

    @Test
    public void testParse() throws Exception {
        SetCommand.Arguments parsed = SetCommand.parse(RespRequest.of("SET", "k", "v", "get", "Px", "10", "nx"));
        assertEquals("k", parsed.key);
        assertArrayEquals("v".getBytes(StandardCharsets.UTF_8), parsed.value);
        assertTrue(parsed.get);
        assertEquals(SetOptions.Condition.NX, parsed.condition);
        assertEquals(SetOptions.ExpiryMode.DEADLINE, parsed.expiryMode);
        assertEquals(Time.now() + 10, parsed.expireAt);
    }

    @Test
    public void testExpiredRequestDoesNotWrite() {
        RequestContext ctx = new RequestContext(Duration.ofMillis(10), 0);
        clock.advance(11);
        assertThrows(TimedOutException.class, () -> cmd.execute(ctx, RespRequest.of("SET", "k", "v")));
        assertNull(value("k"));
    }
}
