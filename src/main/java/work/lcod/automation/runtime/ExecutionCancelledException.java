package work.lcod.automation.runtime;

/**
 * Raised inside a step when the caller cancelled the invocation.
 */
public final class ExecutionCancelledException extends RuntimeException {
    public ExecutionCancelledException(String message) {
        super(message);
    }
}
