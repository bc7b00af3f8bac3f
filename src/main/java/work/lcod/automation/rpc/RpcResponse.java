package work.lcod.automation.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Decoded response line. {@code raw} keeps the whole document so callers can read the extra
 * top-level fields some methods add ({@code refKey}, {@code base64}, {@code loadErrors}, ...).
 */
public record RpcResponse(boolean ok, JsonNode result, String error, ObjectNode raw) {
    static RpcResponse decode(String line) throws TransportException {
        JsonNode node;
        try {
            node = Wire.JSON.readTree(line);
        } catch (Exception ex) {
            throw new TransportException("Malformed response: " + ex.getMessage(), ex);
        }
        if (node == null || !node.isObject() || !node.path("ok").isBoolean()) {
            throw new TransportException("Malformed response: " + abbreviate(line));
        }
        var object = (ObjectNode) node;
        var error = object.path("error");
        return new RpcResponse(
            object.get("ok").booleanValue(),
            object.get("result"),
            error.isTextual() ? error.textValue() : null,
            object
        );
    }

    /** Top-level field, or a missing node when absent. */
    public JsonNode field(String name) {
        return raw.path(name);
    }

    /** Textual result, falling back to the error text for failed calls. */
    public String message() {
        if (!ok) {
            return error != null ? error : "";
        }
        if (result == null || result.isNull()) {
            return "";
        }
        return result.isTextual() ? result.textValue() : result.toString();
    }

    private static String abbreviate(String line) {
        return line.length() <= 120 ? line : line.substring(0, 117) + "...";
    }
}
