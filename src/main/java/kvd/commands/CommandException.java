package kvd.commands;

import kvd.KvdException;

public class CommandException extends KvdException {
    public CommandException(String message) {
        super(message);
    }

    public CommandException(String errorPrefix, String message) {
        super(errorPrefix, message);
    }
}
