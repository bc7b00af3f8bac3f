package work.lcod.automation.runtime;

/**
 * Raised inside a step when the enclosing macro ran out of time.
 */
public final class DeadlineExceededException extends RuntimeException {
    public DeadlineExceededException(String message) {
        super(message);
    }
}
