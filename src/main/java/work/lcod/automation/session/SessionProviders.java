package work.lcod.automation.session;

import java.util.ArrayList;
import java.util.ServiceLoader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Looks up {@link AutomationSessionProvider} implementations on the class path.
 */
public final class SessionProviders {
    private static final Logger log = LogManager.getLogger(SessionProviders.class);

    private SessionProviders() {}

    /**
     * Creates a session from the provider called {@code name}, or from the first provider found when
     * {@code name} is null.
     *
     * @throws IllegalStateException when no matching provider is registered
     */
    public static AutomationSession create(String name) {
        var available = new ArrayList<String>();
        for (var provider : ServiceLoader.load(AutomationSessionProvider.class)) {
            log.debug("Found automation backend {}", provider.name());
            if (name == null || name.equalsIgnoreCase(provider.name())) {
                return provider.create();
            }
            available.add(provider.name());
        }
        if (name == null) {
            throw new IllegalStateException("No automation backend is installed; use --connect to drive a remote server");
        }
        throw new IllegalStateException("Unknown automation backend '" + name + "'. Available: "
            + (available.isEmpty() ? "none" : String.join(", ", available)));
    }
}
