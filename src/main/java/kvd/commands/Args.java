package kvd.commands;

import kvd.KvdException;
import kvd.protocol.BulkStringValue;
import kvd.protocol.IntegerValue;
import kvd.protocol.RespRequest;
import kvd.protocol.RespValue;
import kvd.protocol.SimpleStringValue;

import java.nio.charset.StandardCharsets;

/**
 * Argument accessors shared by command implementations. Index 0 is the first argument
 * after the command name.
 */
public final class Args {
    private Args() {
    }

    public static void requireExactly(RespRequest request, int count, String commandName) throws WrongArgNumberException {
        if (request.argCount() != count) {
            throw new WrongArgNumberException(commandName);
        }
    }

    public static void requireAtLeast(RespRequest request, int count, String commandName) throws WrongArgNumberException {
        if (request.argCount() < count) {
            throw new WrongArgNumberException(commandName);
        }
    }

    /** Payload of a string-typed argument. Integers, arrays and null bulk strings are rejected. */
    public static byte[] bytes(RespRequest request, int index, String commandName) throws KvdException {
        if (index >= request.argCount()) {
            throw new WrongArgNumberException(commandName);
        }
        return bytes(request.arg(index));
    }

    public static byte[] bytes(RespValue value) throws WrongTypeException {
        if (value instanceof BulkStringValue && !((BulkStringValue) value).isNull()) {
            return ((BulkStringValue) value).getBytes();
        }
        if (value instanceof SimpleStringValue) {
            return ((SimpleStringValue) value).getBytes();
        }
        throw new WrongTypeException();
    }

    /** A string-typed argument decoded as UTF-8; malformed bytes raise an encoding error. */
    public static String text(RespRequest request, int index, String commandName) throws KvdException {
        if (index >= request.argCount()) {
            throw new WrongArgNumberException(commandName);
        }
        return text(request.arg(index));
    }

    public static String text(RespValue value) throws KvdException {
        if (value instanceof BulkStringValue && !((BulkStringValue) value).isNull()
                || value instanceof SimpleStringValue) {
            return value.asUtf8();
        }
        throw new WrongTypeException();
    }

    /** An integer argument, given either as a RESP integer or as decimal text. */
    public static long integer(RespValue value) throws KvdException {
        if (value instanceof IntegerValue) {
            return ((IntegerValue) value).getValue();
        }
        String s = new String(bytes(value), StandardCharsets.US_ASCII);
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new InvalidIntegerException();
        }
    }
}
