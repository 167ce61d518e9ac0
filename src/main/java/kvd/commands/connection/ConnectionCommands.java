package kvd.commands.connection;

import kvd.commands.CommandProvider;
import kvd.commands.CommandRegistry;

public class ConnectionCommands implements CommandProvider {
    @Override
    public void registerCommands(CommandRegistry.Builder registry) {
        registry.register("PING", new PingCommand());
        registry.register("VERSION", new VersionCommand(registry.getEnvironment().getBuildInfo()));
    }
}
