package work.lcod.automation.loader;

import java.util.Optional;
import work.lcod.automation.model.MacroDefinition;

/**
 * Name lookup used by the executor to resolve top-level and nested macro calls.
 */
@FunctionalInterface
public interface MacroCatalog {
    Optional<MacroDefinition> find(String name);
}
