package work.lcod.automation.rpc;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.lcod.automation.loader.MacroLibrary;
import work.lcod.automation.loader.SaveRequest;
import work.lcod.automation.model.ElementCriteria;
import work.lcod.automation.model.MacroResult;
import work.lcod.automation.runtime.CancellationToken;
import work.lcod.automation.runtime.MacroExecutor;
import work.lcod.automation.session.AutomationSession;
import work.lcod.automation.session.ElementRef;
import work.lcod.automation.session.LaunchRequest;
import work.lcod.automation.session.SessionResult;
import work.lcod.automation.session.WindowCriteria;
import work.lcod.automation.shared.DurationParser;

/**
 * Wire methods backed by a local {@link AutomationSession} and macro library. Argument names are
 * camelCase ({@code refKey}, {@code processName}, ...).
 */
public final class SessionCommands {
    private static final Logger log = LogManager.getLogger(SessionCommands.class);
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};
    private static final TypeReference<List<Map<String, Object>>> MAP_LIST = new TypeReference<>() {};
    private static final int DEFAULT_SAVE_TIMEOUT_SECONDS = 30;

    private final AutomationSession session;
    private final MacroLibrary library;
    private final MacroExecutor executor;

    public SessionCommands(AutomationSession session, MacroLibrary library, MacroExecutor executor) {
        this.session = Objects.requireNonNull(session, "session");
        this.library = Objects.requireNonNull(library, "library");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public CommandRegistry registry() {
        return registerAll(new CommandRegistry());
    }

    public CommandRegistry registerAll(CommandRegistry registry) {
        return registry
            .register("attach", this::attach)
            .register("status", args -> status())
            .register("snapshot", this::snapshot)
            .register("children", this::children)
            .register("find", this::find)
            .register("findByPath", this::findByPath)
            .register("click", args -> Wire.reply(session.click(required(args, "refKey"))))
            .register("rightClick", args -> Wire.reply(session.rightClick(required(args, "refKey"))))
            .register("type", args -> Wire.reply(session.typeText(required(args, "text"))))
            .register("sendKeys", args -> Wire.reply(session.sendKeys(required(args, "keys"))))
            .register("setValue", args -> Wire.reply(session.setValue(required(args, "refKey"), required(args, "value"))))
            .register("getValue", args -> valueReply(session.getValue(required(args, "refKey"))))
            .register("readProperty", args -> valueReply(session.readProperty(required(args, "refKey"), required(args, "property"))))
            .register("isEnabled", args -> valueReply(session.isEnabled(required(args, "refKey"))))
            .register("properties", args -> valueReply(session.properties(required(args, "refKey"))))
            .register("focus", args -> Wire.reply(session.focus()))
            .register("fileDialog", args -> Wire.reply(session.fileDialog(required(args, "filePath"))))
            .register("screenshot", args -> screenshot())
            .register("launch", this::launch)
            .register("waitForWindow", this::waitForWindow)
            .register("macroList", args -> macroList())
            .register("macro", this::macro)
            .register("executeMacroYaml", this::executeMacroYaml)
            .register("saveMacro", this::saveMacro);
    }

    private ObjectNode attach(JsonNode args) {
        var pid = integer(args, "pid");
        if (pid != null) {
            return Wire.reply(session.attachByPid(pid));
        }
        return Wire.reply(session.attach(required(args, "processName")));
    }

    private ObjectNode status() {
        var attached = session.isAttached();
        var reply = Wire.ok(attached ? "attached" : "not attached");
        reply.put("attached", attached);
        return reply;
    }

    private ObjectNode snapshot(JsonNode args) {
        var depth = integer(args, "maxDepth");
        var result = session.snapshot(depth != null ? depth : executor.limits().snapshotDepth());
        if (!result.success()) {
            return Wire.error(result.message());
        }
        return Wire.ok(result.value() != null ? result.value() : result.message());
    }

    private ObjectNode children(JsonNode args) {
        var result = session.children(text(args, "refKey"));
        if (!result.success()) {
            return Wire.error(result.message());
        }
        var items = Wire.JSON.createArrayNode();
        for (var child : result.value() == null ? List.<ElementRef>of() : result.value()) {
            items.addObject().put("ref", child.refKey()).put("desc", child.description());
        }
        return Wire.ok(items);
    }

    private ObjectNode find(JsonNode args) {
        var criteria = new ElementCriteria(
            text(args, "automationId"),
            text(args, "name"),
            text(args, "className"),
            text(args, "controlType")
        );
        return located(session.find(criteria));
    }

    private ObjectNode findByPath(JsonNode args) {
        var node = args.path("path");
        if (!node.isArray()) {
            return Wire.error("'path' must be an array of strings");
        }
        var path = new ArrayList<String>();
        node.forEach(segment -> path.add(segment.asText()));
        return located(session.findByPath(path));
    }

    private ObjectNode located(SessionResult<ElementRef> result) {
        if (!result.success() || result.value() == null) {
            return Wire.error(result.message());
        }
        var ref = result.value();
        var reply = Wire.ok(result.message());
        reply.put("refKey", ref.refKey());
        reply.put("desc", ref.description());
        var properties = session.properties(ref.refKey());
        if (properties.success() && properties.value() != null) {
            reply.set("properties", Wire.JSON.valueToTree(properties.value()));
        }
        return reply;
    }

    private ObjectNode screenshot() {
        var result = session.screenshot();
        if (!result.success()) {
            return Wire.error(result.message());
        }
        var reply = Wire.ok(result.message());
        reply.put("base64", result.value());
        return reply;
    }

    private ObjectNode launch(JsonNode args) {
        var exePath = text(args, "exePath");
        if (exePath == null || exePath.isEmpty()) {
            return Wire.error("exe_path is required");
        }
        var request = new LaunchRequest(
            exePath,
            text(args, "arguments"),
            text(args, "workingDirectory"),
            !args.path("ifNotRunning").isBoolean() || args.path("ifNotRunning").booleanValue(),
            seconds(args, "timeout", executor.limits().launchTimeout())
        );
        return Wire.reply(session.launch(request));
    }

    private ObjectNode waitForWindow(JsonNode args) {
        var criteria = new WindowCriteria(
            text(args, "titleContains"),
            new ElementCriteria(text(args, "automationId"), text(args, "name"), text(args, "className"), text(args, "controlType"))
        );
        var pollMs = integer(args, "pollMs");
        var poll = pollMs != null ? Duration.ofMillis(pollMs) : executor.limits().windowPoll();
        return Wire.reply(session.waitForWindow(criteria, seconds(args, "timeout", executor.limits().launchTimeout()), poll));
    }

    private ObjectNode macroList() {
        var reply = Wire.ok(library.list());
        var errors = reply.putArray("loadErrors");
        for (var error : library.loadErrors()) {
            errors.addObject()
                .put("filePath", error.filePath())
                .put("macroName", error.macroName())
                .put("message", error.message());
        }
        return reply;
    }

    private ObjectNode macro(JsonNode args) throws IOException {
        var name = text(args, "name");
        if (name == null || name.isEmpty()) {
            return Wire.error("Macro name is required");
        }
        var lines = new ArrayList<String>();
        var result = executor.execute(name, parameters(args), session, lines::add, new CancellationToken());
        return executionReply(result, lines);
    }

    private ObjectNode executeMacroYaml(JsonNode args) throws IOException {
        var yaml = text(args, "yaml");
        if (yaml == null || yaml.isEmpty()) {
            return Wire.error("YAML content is required");
        }
        var lines = new ArrayList<String>();
        var result = executor.executeYaml(yaml, parameters(args), session, lines::add, new CancellationToken());
        return executionReply(result, lines);
    }

    private ObjectNode saveMacro(JsonNode args) throws IOException {
        var name = text(args, "name");
        if (name == null || name.isEmpty()) {
            return Wire.error("Macro name is required");
        }
        var steps = mapList(args.path("steps"));
        if (steps == null) {
            return Wire.error("Steps JSON is required");
        }
        var parameters = mapList(args.path("parameters"));
        var timeout = integer(args, "timeout");
        var request = new SaveRequest(
            name,
            text(args, "description"),
            steps,
            parameters == null ? List.of() : parameters,
            timeout != null ? timeout : DEFAULT_SAVE_TIMEOUT_SECONDS,
            args.path("force").asBoolean(false)
        );
        var result = library.save(request);
        if (!result.success()) {
            return Wire.error(result.message());
        }
        var reply = Wire.ok(result.message());
        reply.put("filePath", result.filePath());
        reply.put("macroName", result.macroName());
        return reply;
    }

    private static ObjectNode executionReply(MacroResult result, List<String> lines) {
        var reply = Wire.JSON.createObjectNode();
        reply.put("ok", result.success());
        reply.set("result", Wire.JSON.valueToTree(result));
        if (!result.success()) {
            reply.put("error", result.message());
        }
        reply.set("log", Wire.JSON.valueToTree(lines));
        log.debug("Macro finished: {}", result.message());
        return reply;
    }

    private static ObjectNode valueReply(SessionResult<?> result) {
        if (!result.success()) {
            return Wire.error(result.message());
        }
        return Wire.ok(result.value());
    }

    /** {@code parameters} as a JSON object or a string holding one. */
    private static Map<String, String> parameters(JsonNode args) throws IOException {
        var node = args.path("parameters");
        if (node.isMissingNode() || node.isNull()) {
            return Map.of();
        }
        if (node.isTextual()) {
            if (node.textValue().isBlank()) {
                return Map.of();
            }
            try {
                return Wire.JSON.readValue(node.textValue(), STRING_MAP);
            } catch (IOException ex) {
                throw new IOException("Invalid parameters JSON: " + ex.getMessage(), ex);
            }
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Invalid parameters JSON: expected an object");
        }
        var parameters = new LinkedHashMap<String, String>();
        node.fields().forEachRemaining(entry -> parameters.put(entry.getKey(),
            entry.getValue().isNull() ? null : entry.getValue().asText()));
        return parameters;
    }

    /** A JSON array of objects, given inline or as a string; null when absent. */
    private static List<Map<String, Object>> mapList(JsonNode node) throws IOException {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            if (node.textValue().isBlank()) {
                return null;
            }
            return Wire.JSON.readValue(node.textValue(), MAP_LIST);
        }
        return Wire.JSON.convertValue(node, MAP_LIST);
    }

    private static String required(JsonNode args, String key) {
        var value = text(args, key);
        if (value == null) {
            throw new IllegalArgumentException("'" + key + "' is required");
        }
        return value;
    }

    private static String text(JsonNode args, String key) {
        var node = args.path(key);
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private static Integer integer(JsonNode args, String key) {
        var node = args.path(key);
        return node.isNumber() ? Integer.valueOf(node.intValue()) : null;
    }

    private static Duration seconds(JsonNode args, String key, Duration fallback) {
        var node = args.path(key);
        return node.isNumber() ? DurationParser.ofSeconds(node.doubleValue()) : fallback;
    }
}
