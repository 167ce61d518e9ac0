package kvd.commands;

public class SyntaxException extends CommandException {
    public SyntaxException() {
        super("syntax error");
    }
}
