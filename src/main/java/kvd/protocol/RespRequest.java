package kvd.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A command invocation: the command name plus its arguments in wire order.
 * Only {@link #fromValue(RespValue)} and the test-friendly factories create one, so a
 * request always comes from an array whose first element is a non-null bulk string.
 */
public final class RespRequest {
    private final byte[] command;
    private final List<RespValue> args;

    private RespRequest(byte[] command, List<RespValue> args) {
        this.command = command;
        this.args = args;
    }

    public static RespRequest fromValue(RespValue value) {
        if (!(value instanceof ArrayValue)) {
            throw new ProtocolException("Invalid request <" + value + ">");
        }
        ArrayValue array = (ArrayValue) value;
        if (array.size() == 0) {
            throw new ProtocolException("Invalid command <" + array + ">");
        }
        RespValue first = array.get(0);
        if (!(first instanceof BulkStringValue) || ((BulkStringValue) first).isNull()) {
            throw new ProtocolException("Invalid command <" + array + ">");
        }
        List<RespValue> elements = array.getElements();
        return new RespRequest(((BulkStringValue) first).rawBytes(),
                Collections.unmodifiableList(new ArrayList<>(elements.subList(1, elements.size()))));
    }

    /** Convenience for tests and embedded callers: every part becomes a bulk string. */
    public static RespRequest of(String command, String... args) {
        String[] parts = new String[args.length + 1];
        parts[0] = command;
        System.arraycopy(args, 0, parts, 1, args.length);
        return fromValue(ArrayValue.ofBulkStrings(parts));
    }

    public byte[] getCommand() {
        return command.clone();
    }

    /** The command name as checked UTF-8 text, case preserved. */
    public String commandName() throws EncodingException {
        return RespValue.decodeUtf8(command, "command name");
    }

    public List<RespValue> getArgs() {
        return args;
    }

    public int argCount() {
        return args.size();
    }

    public RespValue arg(int index) {
        return args.get(index);
    }

    @Override
    public String toString() {
        return "RespRequest{command=" + RespValue.preview(command) + ", args=" + args + "}";
    }
}
