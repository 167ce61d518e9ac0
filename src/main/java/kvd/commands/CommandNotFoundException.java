package kvd.commands;

public class CommandNotFoundException extends CommandException {
    private final String commandName;

    public CommandNotFoundException(String commandName) {
        super("Command <" + commandName + "> not found");
        this.commandName = commandName;
    }

    public String getCommandName() {
        return commandName;
    }
}
