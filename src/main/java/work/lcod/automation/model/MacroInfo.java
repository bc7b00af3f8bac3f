package work.lcod.automation.model;

import java.util.List;

/**
 * Listing view of a loaded macro.
 */
public record MacroInfo(String name, String displayName, String description, List<ParameterSpec> parameters) {
    public static MacroInfo of(String canonicalName, MacroDefinition definition) {
        return new MacroInfo(canonicalName, definition.name(), definition.description(), definition.parameters());
    }
}
