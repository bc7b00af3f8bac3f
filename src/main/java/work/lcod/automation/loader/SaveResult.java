package work.lcod.automation.loader;

/**
 * Outcome of {@link MacroLibrary#save(SaveRequest)}.
 */
public record SaveResult(boolean success, String filePath, String macroName, String message) {
    static SaveResult failure(String macroName, String filePath, String message) {
        return new SaveResult(false, filePath, macroName, message);
    }
}
