package kvd.commands.connection;

import kvd.BuildInfo;
import kvd.commands.Command;
import kvd.context.RequestContext;
import kvd.protocol.BulkStringValue;
import kvd.protocol.RespRequest;
import kvd.protocol.RespValue;

public class VersionCommand implements Command {
    private final BuildInfo buildInfo;

    public VersionCommand(BuildInfo buildInfo) {
        this.buildInfo = buildInfo;
    }

    @Override
    public RespValue execute(RequestContext context, RespRequest request) {
        return BulkStringValue.of(buildInfo.describe());
    }
}
