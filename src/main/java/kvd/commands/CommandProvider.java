package kvd.commands;

/**
 * Service interface through which command packages contribute their commands.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader} and must have a
 * public no-arg constructor. Shared collaborators (the store, build info) are handed in
 * through {@link CommandRegistry.Builder#getEnvironment()}.
 */
public interface CommandProvider {
    void registerCommands(CommandRegistry.Builder registry);
}
