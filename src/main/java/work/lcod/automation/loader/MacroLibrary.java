package work.lcod.automation.loader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.lcod.automation.model.LoadError;
import work.lcod.automation.model.MacroDefinition;
import work.lcod.automation.model.MacroInfo;
import work.lcod.automation.model.MacroValidationException;
import work.lcod.automation.model.StepValidator;

/**
 * Owns the macro table for one macros directory.
 *
 * <p>{@link #reload()} rebuilds the whole table under a single lock and publishes it through a
 * volatile reference, so readers always see either the previous or the next complete
 * {@link MacroSnapshot}. Reload listeners run after publication, outside the lock.
 */
public final class MacroLibrary implements MacroCatalog {
    private static final Logger log = LogManager.getLogger(MacroLibrary.class);
    private static final ObjectMapper YAML_WRITER = new ObjectMapper(
        new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
    );

    private final Path root;
    private final ReentrantLock reloadLock = new ReentrantLock();
    private final List<Consumer<MacroSnapshot>> listeners = new CopyOnWriteArrayList<>();
    private volatile MacroSnapshot snapshot;

    public MacroLibrary(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.snapshot = MacroSnapshot.empty(this.root);
    }

    /** Creates a library and performs the initial load. */
    public static MacroLibrary open(Path root) {
        var library = new MacroLibrary(root);
        library.reload();
        return library;
    }

    public Path root() {
        return root;
    }

    public MacroSnapshot snapshot() {
        return snapshot;
    }

    public MacroSnapshot reload() {
        MacroSnapshot next;
        reloadLock.lock();
        try {
            next = MacroLoader.load(root);
            snapshot = next;
        } finally {
            reloadLock.unlock();
        }
        for (var listener : listeners) {
            try {
                listener.accept(next);
            } catch (RuntimeException ex) {
                log.error("Reload listener failed", ex);
            }
        }
        return next;
    }

    public void addReloadListener(Consumer<MacroSnapshot> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public Optional<MacroDefinition> find(String name) {
        return snapshot.find(name);
    }

    public List<MacroInfo> list() {
        var current = snapshot;
        var infos = new ArrayList<MacroInfo>(current.macros().size());
        current.macros().forEach((name, definition) -> infos.add(MacroInfo.of(name, definition)));
        return infos;
    }

    public List<LoadError> loadErrors() {
        return snapshot.loadErrors();
    }

    public Optional<Path> sourceFile(String name) {
        return snapshot.sourceFile(name);
    }

    /**
     * Validates and writes a new macro document, then reloads so that the macro is immediately
     * available. An existing document is only replaced when {@code force} is set.
     */
    public SaveResult save(SaveRequest request) {
        var name = request.name() == null ? "" : request.name().trim().replace('\\', '/');
        if (name.isEmpty()) {
            return SaveResult.failure(name, "", "Macro name is required");
        }
        var stepError = StepValidator.validate(request.steps());
        if (stepError.isPresent()) {
            return SaveResult.failure(name, "", "Validation error: " + stepError.get());
        }
        var target = root.resolve(name + ".yaml").normalize();
        if (!target.startsWith(root) || name.startsWith("/")) {
            return SaveResult.failure(name, "", "Macro name must stay inside the macros directory");
        }
        if (target.getFileName().toString().startsWith(MacroLoader.SIDE_DOCUMENT_PREFIX)) {
            return SaveResult.failure(name, "", "Macro file names must not start with '" + MacroLoader.SIDE_DOCUMENT_PREFIX + "'");
        }

        var document = new LinkedHashMap<String, Object>();
        document.put("name", name.contains("/") ? name.substring(name.lastIndexOf('/') + 1) : name);
        document.put("description", request.description() == null ? "" : request.description());
        if (request.timeoutSeconds() > 0) {
            document.put("timeout", request.timeoutSeconds());
        }
        if (!request.parameters().isEmpty()) {
            document.put("parameters", request.parameters());
        }
        document.put("steps", request.steps());

        try {
            MacroDocumentParser.fromMap(document);
        } catch (MacroValidationException ex) {
            return SaveResult.failure(name, "", "Validation error: " + ex.getMessage());
        }

        if (Files.exists(target) && !request.force()) {
            return SaveResult.failure(name, target.toString(),
                "Macro '" + name + "' already exists at " + target + ". Use force=true to overwrite.");
        }

        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, YAML_WRITER.writeValueAsString(document), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            log.error("Failed to write macro '{}' to {}", name, target, ex);
            return SaveResult.failure(name, target.toString(), "Failed to write macro: " + ex.getMessage());
        }
        log.info("Saved macro {} -> {}", name, target);
        reload();
        return new SaveResult(true, target.toString(), name, "Macro '" + name + "' saved to " + target);
    }
}
