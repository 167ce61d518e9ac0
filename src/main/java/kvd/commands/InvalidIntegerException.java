package kvd.commands;

public class InvalidIntegerException extends CommandException {
    public InvalidIntegerException() {
        super("value is not an integer or out of range");
    }
}
