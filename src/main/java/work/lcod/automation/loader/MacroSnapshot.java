package work.lcod.automation.loader;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import work.lcod.automation.model.LoadError;
import work.lcod.automation.model.MacroDefinition;

/**
 * Result of one load pass. Never mutated after construction; a reload publishes a new instance.
 */
public record MacroSnapshot(
    Path root,
    Map<String, MacroDefinition> macros,
    Map<String, Path> sources,
    List<LoadError> loadErrors,
    Instant loadedAt
) implements MacroCatalog {
    public MacroSnapshot {
        Objects.requireNonNull(root, "root");
        macros = caseInsensitiveCopy(macros);
        sources = caseInsensitiveCopy(sources);
        loadErrors = List.copyOf(loadErrors);
        loadedAt = loadedAt == null ? Instant.now() : loadedAt;
    }

    public static MacroSnapshot empty(Path root) {
        return new MacroSnapshot(root, Map.of(), Map.of(), List.of(), Instant.now());
    }

    @Override
    public Optional<MacroDefinition> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(macros.get(name));
    }

    public Optional<Path> sourceFile(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(sources.get(name));
    }

    private static <V> Map<String, V> caseInsensitiveCopy(Map<String, V> source) {
        var copy = new TreeMap<String, V>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(Objects.requireNonNull(source));
        return Collections.unmodifiableSortedMap(copy);
    }
}
