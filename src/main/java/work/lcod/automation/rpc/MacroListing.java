package work.lcod.automation.rpc;

import java.util.List;
import work.lcod.automation.model.LoadError;
import work.lcod.automation.model.MacroInfo;

/**
 * Macros known to a server together with the documents it failed to load.
 */
public record MacroListing(List<MacroInfo> macros, List<LoadError> loadErrors) {
    public MacroListing {
        macros = macros == null ? List.of() : List.copyOf(macros);
        loadErrors = loadErrors == null ? List.of() : List.copyOf(loadErrors);
    }
}
