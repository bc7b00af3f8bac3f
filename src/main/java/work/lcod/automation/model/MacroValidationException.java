package work.lcod.automation.model;

/**
 * Raised when a macro document or a raw step list is rejected before execution.
 */
public final class MacroValidationException extends IllegalArgumentException {
    public MacroValidationException(String message) {
        super(message);
    }
}
