package kvd.network;

import kvd.BuildInfo;
import kvd.commands.CommandEnvironment;
import kvd.commands.CommandRegistry;
import kvd.commands.SyntaxException;
import kvd.commands.connection.ConnectionCommands;
import kvd.commands.string.StringCommands;
import kvd.db.Store;
import kvd.protocol.ArrayValue;
import kvd.protocol.BulkStringValue;
import kvd.protocol.ErrorValue;
import kvd.protocol.RespRequest;
import kvd.protocol.RespValue;
import kvd.protocol.SimpleStringValue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class CommandDispatcherTest {

    private ScheduledExecutorService timer;
    private CountDownLatch interrupted;
    private CommandDispatcher dispatcher;

    @BeforeEach
    public void setup() {
        timer = Executors.newSingleThreadScheduledExecutor();
        interrupted = new CountDownLatch(1);

        CommandRegistry.Builder builder = CommandRegistry.builder(
                new CommandEnvironment(new Store(), new BuildInfo("kvd", "test", "")));
        new ConnectionCommands().registerCommands(builder);
        new StringCommands().registerCommands(builder);
        builder.register("SLEEP", (ctx, req) -> {
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return SimpleStringValue.OK;
        });
        builder.register("BADSYNTAX", (ctx, req) -> {
            throw new SyntaxException();
        });
        builder.register("CRASH", (ctx, req) -> {
            throw new IllegalStateException("boom");
        });

        dispatcher = new CommandDispatcher(builder.build(), Duration.ofMillis(200), 3, 2);
    }

    @AfterEach
    public void tearDown() {
        dispatcher.close();
        timer.shutdownNow();
    }

    private RespValue call(String command, String... args) throws Exception {
        return dispatcher.dispatch(RespRequest.of(command, args), timer).get(5, TimeUnit.SECONDS);
    }

    private static String error(RespValue value) {
        assertTrue(value instanceof ErrorValue, "expected an error but got " + value);
        return ((ErrorValue) value).getMessage();
    }

    @Test
    public void testDispatchesToHandler() throws Exception {
        assertEquals(SimpleStringValue.PONG, call("PING"));
        assertEquals(SimpleStringValue.OK, call("SET", "k", "v"));
        assertEquals(BulkStringValue.of("v"), call("GET", "k"));
        assertEquals(3, dispatcher.getTotalCommands());
    }

    @Test
    public void testCommandNamesAreCaseInsensitive() throws Exception {
        assertEquals(SimpleStringValue.PONG, call("ping"));
        assertEquals(SimpleStringValue.PONG, call("PiNg"));
    }

    @Test
    public void testUnknownCommand() throws Exception {
        String message = error(call("FOO", "bar"));
        assertTrue(message.startsWith("ERR"));
        assertTrue(message.contains("FOO"));
    }

    @Test
    public void testHandlerErrorsBecomeReplies() throws Exception {
        assertEquals("ERR syntax error", error(call("BADSYNTAX")));
        assertEquals("ERR wrong number of arguments for 'get' command", error(call("GET")));

        String crash = error(call("CRASH"));
        assertTrue(crash.startsWith("ERR internal error"));
        assertTrue(crash.contains("boom"));
    }

    @Test
    public void testNonUtf8CommandName() throws Exception {
        RespRequest req = RespRequest.fromValue(ArrayValue.of(BulkStringValue.of(new byte[]{(byte) 0xFF, (byte) 0xFE})));
        RespValue reply = dispatcher.dispatch(req, timer).get(5, TimeUnit.SECONDS);
        assertTrue(error(reply).startsWith("ERR"));
    }

    @Test
    public void testSlowHandlerTimesOut() throws Exception {
        long start = System.nanoTime();
        String message = error(call("SLEEP"));
        long tookMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(message.contains("Timeout"), message);
        assertTrue(tookMillis < 4000, "reply should not wait for the handler, took " + tookMillis + " ms");
        assertTrue(interrupted.await(5, TimeUnit.SECONDS), "timed out handler should be interrupted");
    }

    @Test
    public void testNoDeadline() throws Exception {
        CommandDispatcher unbounded = new CommandDispatcher(dispatcher.getRegistry(), null, 0, 1);
        try {
            RespValue reply = unbounded.dispatch(RespRequest.of("PING"), timer).get(5, TimeUnit.SECONDS);
            assertEquals(SimpleStringValue.PONG, reply);
        } finally {
            unbounded.close();
        }
    }

    @Test
    public void testRejectsAfterClose() throws Exception {
        dispatcher.close();
        assertTrue(error(call("PING")).contains("shutting down"));
    }
}
