package work.lcod.automation.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import work.lcod.automation.session.SessionResult;

/**
 * JSON-lines framing shared by client and server: one document per line,
 * {@code {"ok": true, "result": ...}} or {@code {"ok": false, "error": "..."}}.
 */
public final class Wire {
    public static final ObjectMapper JSON = new ObjectMapper();

    private Wire() {}

    public static ObjectNode ok(Object result) {
        var reply = JSON.createObjectNode();
        reply.put("ok", true);
        reply.set("result", result instanceof JsonNode node ? node : JSON.valueToTree(result));
        return reply;
    }

    public static ObjectNode error(String message) {
        var reply = JSON.createObjectNode();
        reply.put("ok", false);
        reply.put("error", message == null ? "" : message);
        return reply;
    }

    /** Success carries the message as result, failure as error. */
    public static ObjectNode reply(SessionResult<?> result) {
        return result.success() ? ok(result.message()) : error(result.message());
    }

    public static ObjectNode request(String method, ObjectNode args) {
        var request = JSON.createObjectNode();
        request.put("method", method);
        request.set("args", args == null ? JSON.createObjectNode() : args);
        return request;
    }

    public static String encode(JsonNode node) {
        // compact form, always a single line
        return node.toString();
    }
}
