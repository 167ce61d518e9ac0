package kvd.commands.string;

import kvd.KvdException;
import kvd.commands.Args;
import kvd.commands.Command;
import kvd.commands.CommandException;
import kvd.commands.SyntaxException;
import kvd.context.RequestContext;
import kvd.db.SetOptions;
import kvd.db.SetResult;
import kvd.db.Store;
import kvd.protocol.BulkStringValue;
import kvd.protocol.RespRequest;
import kvd.protocol.RespValue;
import kvd.protocol.SimpleStringValue;
import kvd.utils.Time;

import java.util.Locale;

/**
 * SET key value [EX seconds | PX milliseconds | KEEPTTL] [NX | XX] [GET]
 *
 * <p>Options may appear in any order. Conflicting options (NX with XX, or more than one
 * expiry option) are a syntax error. With GET the reply is the previous value, whether
 * or not the write happened.
 */
public class SetCommand implements Command {
    private final Store store;

    public SetCommand(Store store) {
        this.store = store;
    }

    static final class Arguments {
        String key;
        byte[] value;
        SetOptions.Condition condition = SetOptions.Condition.ALWAYS;
        SetOptions.ExpiryMode expiryMode = SetOptions.ExpiryMode.CLEAR;
        long expireAt = -1;
        boolean get;
        private boolean expirySeen;

        SetOptions toOptions() {
            return SetOptions.of(condition, expiryMode, expireAt);
        }
    }

    @Override
    public RespValue execute(RequestContext context, RespRequest request) throws KvdException {
        Arguments parsed = parse(request);

        // A request already past its deadline must not write
        context.checkTimeout();
        SetResult result = store.set(parsed.key, parsed.value, parsed.toOptions());

        if (parsed.get) {
            return BulkStringValue.of(result.getPrevious());
        }
        return result.isApplied() ? SimpleStringValue.OK : BulkStringValue.NULL;
    }

    static Arguments parse(RespRequest request) throws KvdException {
        Args.requireAtLeast(request, 2, "set");
        Arguments parsed = new Arguments();
        parsed.key = Args.text(request, 0, "set");
        parsed.value = Args.bytes(request, 1, "set");

        for (int i = 2; i < request.argCount(); i++) {
            String option = Args.text(request.arg(i)).toUpperCase(Locale.ROOT);
            switch (option) {
                case "EX":
                case "PX": {
                    if (parsed.expirySeen || i + 1 >= request.argCount()) {
                        throw new SyntaxException();
                    }
                    long amount = Args.integer(request.arg(++i));
                    parsed.expireAt = deadline(amount, option.equals("EX") ? 1000 : 1);
                    parsed.expiryMode = SetOptions.ExpiryMode.DEADLINE;
                    parsed.expirySeen = true;
                    break;
                }
                case "KEEPTTL":
                    if (parsed.expirySeen) throw new SyntaxException();
                    parsed.expiryMode = SetOptions.ExpiryMode.KEEP;
                    parsed.expirySeen = true;
                    break;
                case "NX":
                case "XX":
                    if (parsed.condition != SetOptions.Condition.ALWAYS) throw new SyntaxException();
                    parsed.condition = option.equals("NX") ? SetOptions.Condition.NX : SetOptions.Condition.XX;
                    break;
                case "GET":
                    parsed.get = true;
                    break;
                default:
                    throw new SyntaxException();
            }
        }
        return parsed;
    }

    private static long deadline(long amount, long unitMillis) throws CommandException {
        if (amount <= 0) {
            throw new CommandException("invalid expire time in 'set' command");
        }
        try {
            return Math.addExact(Time.now(), Math.multiplyExact(amount, unitMillis));
        } catch (ArithmeticException e) {
            throw new CommandException("invalid expire time in 'set' command");
        }
    }
}
