package work.lcod.automation.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A method served over the wire. Returns the complete response document; an exception becomes an
 * error response carrying its message.
 */
@FunctionalInterface
public interface CommandFunction {
    ObjectNode invoke(JsonNode args) throws Exception;
}
