package kvd.commands.string;

import kvd.commands.CommandProvider;
import kvd.commands.CommandRegistry;
import kvd.db.Store;

public class StringCommands implements CommandProvider {
    @Override
    public void registerCommands(CommandRegistry.Builder registry) {
        Store store = registry.getEnvironment().getStore();
        registry.register("GET", new GetCommand(store));
        registry.register("SET", new SetCommand(store));
    }
}
