package work.lcod.automation.loader;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.lcod.automation.model.LoadError;
import work.lcod.automation.model.MacroDefinition;
import work.lcod.automation.model.MacroValidationException;

/**
 * Scans a macros directory into a {@link MacroSnapshot}. A document that cannot be used is
 * recorded as a {@link LoadError}; it never stops the scan.
 */
public final class MacroLoader {
    private static final Logger log = LogManager.getLogger(MacroLoader.class);

    /** Documents starting with this prefix hold side data and are not macros. */
    public static final String SIDE_DOCUMENT_PREFIX = "_";

    private static final List<String> EXTENSIONS = List.of(".yaml", ".yml");

    private MacroLoader() {}

    public static MacroSnapshot load(Path root) {
        var normalizedRoot = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(normalizedRoot)) {
            log.debug("Macros directory {} does not exist", normalizedRoot);
            return MacroSnapshot.empty(normalizedRoot);
        }

        var macros = new TreeMap<String, MacroDefinition>(String.CASE_INSENSITIVE_ORDER);
        var sources = new TreeMap<String, Path>(String.CASE_INSENSITIVE_ORDER);
        var relativeSources = new LinkedHashMap<String, String>();
        var errors = new ArrayList<LoadError>();

        for (var file : listDocuments(normalizedRoot, errors)) {
            var relative = relativePath(normalizedRoot, file);
            var name = canonicalName(relative);
            var existing = sources.get(name);
            if (existing != null) {
                reject(errors, relative, name, "Duplicate macro name, already loaded from " + relativePath(normalizedRoot, existing));
                continue;
            }
            try (var in = Files.newInputStream(file)) {
                var parsed = MacroDocumentParser.parse(in);
                if (parsed.isEmpty()) {
                    reject(errors, relative, name, "Document is empty");
                } else if (parsed.get().steps().isEmpty()) {
                    reject(errors, relative, name, "Macro has no steps defined");
                } else {
                    macros.put(name, parsed.get());
                    sources.put(name, file);
                    relativeSources.put(name, relative);
                }
            } catch (IOException | MacroValidationException ex) {
                reject(errors, relative, name, ex.getMessage());
            }
        }

        var expansion = IncludeExpander.expand(macros, relativeSources);
        errors.addAll(expansion.errors());
        var loadedSources = new TreeMap<String, Path>(String.CASE_INSENSITIVE_ORDER);
        for (var name : expansion.macros().keySet()) {
            loadedSources.put(name, sources.get(name));
        }

        if (errors.isEmpty()) {
            log.info("Reloaded {}: {} macros", normalizedRoot, expansion.macros().size());
        } else {
            log.info("Reloaded {}: {} macros, {} errors", normalizedRoot, expansion.macros().size(), errors.size());
        }
        return new MacroSnapshot(normalizedRoot, expansion.macros(), loadedSources, errors, Instant.now());
    }

    /** Canonical name of a document: its root-relative path with {@code /} separators and no extension. */
    public static String canonicalName(String relativePath) {
        var normalized = relativePath.replace('\\', '/');
        var lower = normalized.toLowerCase(Locale.ROOT);
        for (var extension : EXTENSIONS) {
            if (lower.endsWith(extension)) {
                return normalized.substring(0, normalized.length() - extension.length());
            }
        }
        return normalized;
    }

    static boolean isMacroDocument(Path file) {
        var fileName = file.getFileName().toString();
        if (fileName.startsWith(SIDE_DOCUMENT_PREFIX)) {
            return false;
        }
        var lower = fileName.toLowerCase(Locale.ROOT);
        return EXTENSIONS.stream().anyMatch(lower::endsWith);
    }

    /** Sorted macro documents under {@code root}; a directory that cannot be read is recorded and skipped. */
    private static List<Path> listDocuments(Path root, List<LoadError> errors) {
        var documents = new ArrayList<Path>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (Files.isRegularFile(file) && isMacroDocument(file)) {
                        documents.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    unreadable(errors, root, file, exc);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                    if (exc != null) {
                        unreadable(errors, root, dir, exc);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to scan macros directory: " + root, ex);
        }
        documents.sort(null);
        return documents;
    }

    private static void unreadable(List<LoadError> errors, Path root, Path path, IOException exc) {
        var relative = relativePath(root, path);
        var reason = exc.getMessage() == null ? exc.getClass().getSimpleName() : exc.getMessage();
        reject(errors, relative, canonicalName(relative), "Cannot read " + (Files.isDirectory(path) ? "directory" : "file") + ": " + reason);
    }

    private static String relativePath(Path root, Path file) {
        var parts = new ArrayList<String>();
        for (var segment : root.relativize(file)) {
            parts.add(segment.toString());
        }
        return String.join("/", parts);
    }

    private static void reject(List<LoadError> errors, String relative, String name, String message) {
        log.warn("Failed to load macro '{}' from {}: {}", name, relative, message);
        errors.add(new LoadError(relative, name, message));
    }
}
