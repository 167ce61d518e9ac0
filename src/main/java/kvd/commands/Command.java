package kvd.commands;

import kvd.KvdException;
import kvd.context.RequestContext;
import kvd.protocol.RespRequest;
import kvd.protocol.RespValue;

/**
 * One command's behavior. Implementations validate their own arguments and either
 * return the reply value or throw a {@link KvdException} that the server turns into an
 * error reply.
 *
 * <p>Implementations must be thread-safe: one instance serves every connection.
 */
@FunctionalInterface
public interface Command {
    RespValue execute(RequestContext context, RespRequest request) throws KvdException;
}
