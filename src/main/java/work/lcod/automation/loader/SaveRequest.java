package work.lcod.automation.loader;

import java.util.List;
import java.util.Map;

/**
 * New macro document to write under the macros root. {@code steps} and {@code parameters} use the
 * document's raw shape so they can be validated exactly like a file on disk.
 */
public record SaveRequest(
    String name,
    String description,
    List<Map<String, Object>> steps,
    List<Map<String, Object>> parameters,
    int timeoutSeconds,
    boolean force
) {
    public SaveRequest {
        steps = steps == null ? List.of() : List.copyOf(steps);
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }
}
