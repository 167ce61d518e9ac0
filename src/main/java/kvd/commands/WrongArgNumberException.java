package kvd.commands;

public class WrongArgNumberException extends CommandException {
    public WrongArgNumberException(String commandName) {
        super("wrong number of arguments for '" + commandName + "' command");
    }
}
