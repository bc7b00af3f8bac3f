package work.lcod.automation.rpc;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Method table of an {@link RpcServer}. Method names are case-sensitive.
 */
public final class CommandRegistry {
    private final Map<String, CommandFunction> commands = new ConcurrentHashMap<>();

    public CommandRegistry register(String method, CommandFunction fn) {
        commands.put(method, fn);
        return this;
    }

    public Optional<CommandFunction> get(String method) {
        return method == null ? Optional.empty() : Optional.ofNullable(commands.get(method));
    }
}
