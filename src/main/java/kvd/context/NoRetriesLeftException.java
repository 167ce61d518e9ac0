package kvd.context;

import kvd.KvdException;

public class NoRetriesLeftException extends KvdException {
    public NoRetriesLeftException() {
        super("No more retries");
    }
}
