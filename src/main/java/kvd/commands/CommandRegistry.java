package kvd.commands;

import kvd.utils.Log;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable mapping from command name to {@link Command}.
 *
 * <p>Built once, either from every {@link CommandProvider} on the class path or explicitly
 * through {@link #builder(CommandEnvironment)}, then shared read-only by all connections.
 * Names are matched exactly; the server upper-cases incoming names before lookup.
 */
public final class CommandRegistry {
    private final Map<String, Command> commands;

    private CommandRegistry(Map<String, Command> commands) {
        this.commands = Collections.unmodifiableMap(new HashMap<>(commands));
    }

    public static Builder builder(CommandEnvironment environment) {
        return new Builder(environment);
    }

    public static CommandRegistry fromServiceLoader(CommandEnvironment environment, ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Builder builder = new Builder(environment);
        for (CommandProvider provider : ServiceLoader.load(CommandProvider.class, cl)) {
            provider.registerCommands(builder);
            Log.debug("Loaded commands from " + provider.getClass().getName());
        }
        return builder.build();
    }

    public static CommandRegistry fromServiceLoader(CommandEnvironment environment) {
        return fromServiceLoader(environment, CommandRegistry.class.getClassLoader());
    }

    public Command getHandler(String name) throws CommandNotFoundException {
        Command command = commands.get(name);
        if (command == null) {
            throw new CommandNotFoundException(name);
        }
        return command;
    }

    public boolean contains(String name) {
        return commands.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(commands.keySet()));
    }

    public int size() {
        return commands.size();
    }

    public static final class Builder {
        private final CommandEnvironment environment;
        private final Map<String, Command> commands = new HashMap<>();

        private Builder(CommandEnvironment environment) {
            this.environment = environment;
        }

        public CommandEnvironment getEnvironment() {
            return environment;
        }

        public Builder register(String name, Command command) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(command, "command");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("command name must not be empty");
            }
            if (commands.putIfAbsent(name, command) != null) {
                throw new IllegalStateException("Command " + name + " registered twice");
            }
            return this;
        }

        public CommandRegistry build() {
            return new CommandRegistry(commands);
        }
    }
}
