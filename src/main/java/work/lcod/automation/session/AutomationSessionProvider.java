package work.lcod.automation.session;

/**
 * Service-loaded factory for the backend served by {@code lcod-automation serve}. Implementations
 * are registered under {@code META-INF/services/work.lcod.automation.session.AutomationSessionProvider}.
 */
public interface AutomationSessionProvider {
    /** Identifier used to pick a provider when several are on the class path. */
    String name();

    AutomationSession create();
}
