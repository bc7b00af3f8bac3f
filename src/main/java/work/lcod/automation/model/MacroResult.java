package work.lcod.automation.model;

/**
 * Outcome of one macro invocation. {@code failedStepIndex} is 1-based and only set on failure.
 */
public record MacroResult(
    boolean success,
    int stepsExecuted,
    int totalSteps,
    String message,
    Integer failedStepIndex,
    String failedAction,
    String error
) {
    public static MacroResult completed(int totalSteps, String message) {
        return new MacroResult(true, totalSteps, totalSteps, message, null, null, null);
    }

    /** Failure detected before any step ran (unknown macro, missing parameters). */
    public static MacroResult rejected(int totalSteps, String message) {
        return new MacroResult(false, 0, totalSteps, message, null, null, message);
    }

    public static MacroResult failedAt(int stepNumber, int totalSteps, StepAction action, String message, String error) {
        return new MacroResult(false, stepNumber - 1, totalSteps, message, stepNumber, action.wireName(), error);
    }
}
