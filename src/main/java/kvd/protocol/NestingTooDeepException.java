package kvd.protocol;

public class NestingTooDeepException extends ProtocolException {
    private final int maxDepth;

    public NestingTooDeepException(int maxDepth) {
        super("Array nesting deeper than " + maxDepth);
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
