package work.lcod.automation.runtime;

/**
 * Result of one step: {@code message} is reported on success and failure alike, {@code error}
 * carries extra diagnostics for a failure (the search that came up empty, for instance).
 */
public record StepOutcome(boolean success, String message, String error) {
    public static StepOutcome ok(String message) {
        return new StepOutcome(true, message, null);
    }

    public static StepOutcome failed(String message) {
        return new StepOutcome(false, message, null);
    }

    public static StepOutcome failed(String message, String error) {
        return new StepOutcome(false, message, error);
    }

    /** Text for the failure log line and the macro result's error field. */
    public String failureText() {
        return error != null ? error : message;
    }
}
