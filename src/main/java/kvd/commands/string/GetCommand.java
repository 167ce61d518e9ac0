package kvd.commands.string;

import kvd.KvdException;
import kvd.commands.Args;
import kvd.commands.Command;
import kvd.context.RequestContext;
import kvd.db.Store;
import kvd.protocol.BulkStringValue;
import kvd.protocol.RespRequest;
import kvd.protocol.RespValue;

/**
 * GET key
 */
public class GetCommand implements Command {
    private final Store store;

    public GetCommand(Store store) {
        this.store = store;
    }

    @Override
    public RespValue execute(RequestContext context, RespRequest request) throws KvdException {
        Args.requireExactly(request, 1, "get");
        String key = Args.text(request, 0, "get");
        return BulkStringValue.of(store.get(key));
    }
}
