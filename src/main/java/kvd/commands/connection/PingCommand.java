package kvd.commands.connection;

import kvd.commands.Command;
import kvd.context.RequestContext;
import kvd.protocol.RespRequest;
import kvd.protocol.RespValue;
import kvd.protocol.SimpleStringValue;

/**
 * PING: always replies PONG; arguments are ignored.
 */
public class PingCommand implements Command {
    @Override
    public RespValue execute(RequestContext context, RespRequest request) {
        return SimpleStringValue.PONG;
    }
}
