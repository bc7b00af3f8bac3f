package work.lcod.automation.model;

/**
 * A macro document that could not be turned into a usable macro during the last load pass.
 */
public record LoadError(String filePath, String macroName, String message) {}
