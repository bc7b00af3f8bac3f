package work.lcod.automation.rpc;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import work.lcod.automation.model.ElementCriteria;
import work.lcod.automation.model.LoadError;
import work.lcod.automation.model.MacroInfo;
import work.lcod.automation.model.MacroResult;
import work.lcod.automation.session.AutomationSession;
import work.lcod.automation.session.ElementRef;
import work.lcod.automation.session.LaunchRequest;
import work.lcod.automation.session.SessionResult;
import work.lcod.automation.session.WindowCriteria;

/**
 * {@link AutomationSession} whose backend lives behind an {@link RpcClient}. Transport failures
 * surface as {@link UncheckedIOException}; the executor reports them as step errors.
 *
 * <p>Plain calls are bounded by {@code callTimeout} (null for none). Calls that wait on the target
 * application ({@code launch}, {@code waitForWindow}) get their own wait added on top. Server-side
 * macro runs are never bounded here; the server enforces the macro timeout.
 */
public final class RemoteSession implements AutomationSession {
    private static final TypeReference<List<MacroInfo>> MACRO_LIST = new TypeReference<>() {};
    private static final TypeReference<List<LoadError>> ERROR_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    private final RpcClient client;
    private final Duration callTimeout;

    public RemoteSession(RpcClient client, Duration callTimeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.callTimeout = callTimeout;
    }

    @Override
    public SessionResult<String> attach(String processName) {
        return message(call("attach", RpcClient.args().put("processName", processName)));
    }

    @Override
    public SessionResult<String> attachByPid(int pid) {
        return message(call("attach", RpcClient.args().put("pid", pid)));
    }

    /** Asks the server; a transport fault surfaces like any other call's. */
    @Override
    public boolean isAttached() {
        return call("status", RpcClient.args()).field("attached").asBoolean(false);
    }

    @Override
    public SessionResult<String> focus() {
        return message(call("focus", RpcClient.args()));
    }

    @Override
    public SessionResult<String> snapshot(int maxDepth) {
        return message(call("snapshot", RpcClient.args().put("maxDepth", maxDepth)));
    }

    @Override
    public SessionResult<ElementRef> find(ElementCriteria criteria) {
        var args = RpcClient.args();
        putIfSet(args, "automationId", criteria.automationId());
        putIfSet(args, "name", criteria.name());
        putIfSet(args, "className", criteria.className());
        putIfSet(args, "controlType", criteria.controlType());
        return located(call("find", args));
    }

    @Override
    public SessionResult<ElementRef> findByPath(List<String> path) {
        var args = RpcClient.args();
        var segments = args.putArray("path");
        path.forEach(segments::add);
        return located(call("findByPath", args));
    }

    @Override
    public SessionResult<List<ElementRef>> children(String ref) {
        var args = RpcClient.args();
        putIfSet(args, "refKey", ref);
        var response = call("children", args);
        if (!response.ok()) {
            return SessionResult.failure(response.message());
        }
        var children = new ArrayList<ElementRef>();
        if (response.result() != null) {
            for (var item : response.result()) {
                children.add(new ElementRef(item.path("ref").asText(), item.path("desc").asText()));
            }
        }
        return SessionResult.ok(children, "Found " + children.size() + " children");
    }

    @Override
    public SessionResult<String> click(String ref) {
        return message(call("click", RpcClient.args().put("refKey", ref)));
    }

    @Override
    public SessionResult<String> rightClick(String ref) {
        return message(call("rightClick", RpcClient.args().put("refKey", ref)));
    }

    @Override
    public SessionResult<String> typeText(String text) {
        return message(call("type", RpcClient.args().put("text", text)));
    }

    @Override
    public SessionResult<String> sendKeys(String keys) {
        return message(call("sendKeys", RpcClient.args().put("keys", keys)));
    }

    @Override
    public SessionResult<String> setValue(String ref, String value) {
        return message(call("setValue", RpcClient.args().put("refKey", ref).put("value", value)));
    }

    @Override
    public SessionResult<String> getValue(String ref) {
        return message(call("getValue", RpcClient.args().put("refKey", ref)));
    }

    @Override
    public SessionResult<String> readProperty(String ref, String property) {
        return message(call("readProperty", RpcClient.args().put("refKey", ref).put("property", property)));
    }

    @Override
    public SessionResult<Map<String, String>> properties(String ref) {
        var response = call("properties", RpcClient.args().put("refKey", ref));
        if (!response.ok()) {
            return SessionResult.failure(response.message());
        }
        Map<String, String> properties = response.result() == null
            ? Map.of()
            : Wire.JSON.convertValue(response.result(), STRING_MAP);
        return SessionResult.ok(properties, properties.size() + " properties");
    }

    @Override
    public SessionResult<Boolean> isEnabled(String ref) {
        var response = call("isEnabled", RpcClient.args().put("refKey", ref));
        if (!response.ok()) {
            return SessionResult.failure(response.message());
        }
        var enabled = response.result() != null && response.result().asBoolean(false);
        return SessionResult.ok(enabled, "IsEnabled=" + enabled);
    }

    @Override
    public SessionResult<String> fileDialog(String filePath) {
        return message(call("fileDialog", RpcClient.args().put("filePath", filePath)));
    }

    @Override
    public SessionResult<String> screenshot() {
        var response = call("screenshot", RpcClient.args());
        if (!response.ok()) {
            return SessionResult.failure(response.message());
        }
        var base64 = response.field("base64");
        return SessionResult.ok(base64.isTextual() ? base64.textValue() : null, response.message());
    }

    @Override
    public SessionResult<String> launch(LaunchRequest request) {
        var args = RpcClient.args().put("exePath", request.exePath());
        putIfSet(args, "arguments", request.arguments());
        putIfSet(args, "workingDirectory", request.workingDirectory());
        args.put("ifNotRunning", request.ifNotRunning());
        args.put("timeout", seconds(request.timeout()));
        return message(call("launch", args, extended(request.timeout())));
    }

    @Override
    public SessionResult<String> waitForWindow(WindowCriteria criteria, Duration timeout, Duration pollInterval) {
        var args = RpcClient.args();
        putIfSet(args, "titleContains", criteria.titleContains());
        putIfSet(args, "automationId", criteria.element().automationId());
        putIfSet(args, "name", criteria.element().name());
        putIfSet(args, "className", criteria.element().className());
        putIfSet(args, "controlType", criteria.element().controlType());
        args.put("timeout", seconds(timeout));
        args.put("pollMs", pollInterval.toMillis());
        return message(call("waitForWindow", args, extended(timeout)));
    }

    /** Macros loaded by the server. */
    public MacroListing listMacros() throws IOException {
        var response = client.call("macroList", RpcClient.args(), callTimeout);
        if (!response.ok()) {
            throw new IOException(response.message());
        }
        var errors = response.field("loadErrors");
        return new MacroListing(
            response.result() == null ? List.of() : Wire.JSON.convertValue(response.result(), MACRO_LIST),
            errors.isArray() ? Wire.JSON.convertValue(errors, ERROR_LIST) : List.of()
        );
    }

    /** Runs a macro from the server's library against the server's own session. */
    public MacroResult runMacro(String name, Map<String, String> parameters, Consumer<String> sink) throws IOException {
        var args = RpcClient.args().put("name", name);
        args.set("parameters", Wire.JSON.valueToTree(parameters == null ? Map.of() : parameters));
        return execution(client.call("macro", args), sink);
    }

    /** Sends a macro document for the server to run without registering it. */
    public MacroResult runMacroYaml(String yaml, Map<String, String> parameters, Consumer<String> sink) throws IOException {
        var args = RpcClient.args().put("yaml", yaml);
        args.set("parameters", Wire.JSON.valueToTree(parameters == null ? Map.of() : parameters));
        return execution(client.call("executeMacroYaml", args), sink);
    }

    private static MacroResult execution(RpcResponse response, Consumer<String> sink) throws IOException {
        var lines = response.field("log");
        if (sink != null && lines.isArray()) {
            lines.forEach(line -> sink.accept(line.asText()));
        }
        var result = response.result();
        if (result == null || !result.isObject()) {
            return MacroResult.rejected(0, response.message());
        }
        return Wire.JSON.treeToValue(result, MacroResult.class);
    }

    private RpcResponse call(String method, ObjectNode args) {
        return call(method, args, callTimeout);
    }

    private RpcResponse call(String method, ObjectNode args, Duration timeout) {
        try {
            return client.call(method, args, timeout);
        } catch (IOException ex) {
            throw new UncheckedIOException("Call '" + method + "' failed: " + ex.getMessage(), ex);
        }
    }

    private Duration extended(Duration wait) {
        return callTimeout == null ? null : callTimeout.plus(wait);
    }

    private static SessionResult<String> message(RpcResponse response) {
        return response.ok() ? SessionResult.ok(response.message()) : SessionResult.failure(response.message());
    }

    private static SessionResult<ElementRef> located(RpcResponse response) {
        if (!response.ok()) {
            return SessionResult.failure(response.message());
        }
        var desc = response.field("desc").asText("");
        var ref = new ElementRef(response.field("refKey").asText(), desc);
        return SessionResult.ok(ref, desc.isEmpty() ? response.message() : desc);
    }

    private static double seconds(Duration duration) {
        return duration.toMillis() / 1000.0;
    }

    private static void putIfSet(ObjectNode args, String key, String value) {
        if (value != null) {
            args.put(key, value);
        }
    }
}
