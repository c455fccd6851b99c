package net.spookly.appurls.app;

/**
 * Service provider contributing one blueprint to every application assembled from its group.
 * <p>
 * Providers are discovered with {@link java.util.ServiceLoader}; list implementations in
 * {@code META-INF/services/net.spookly.appurls.app.BlueprintProvider}. Implementations need a public
 * no-argument constructor and should defer all work to {@link #create(WebApplication)}.
 */
public interface BlueprintProvider {
    /**
     * Group this provider belongs to, for example {@code appurls.api_blueprints}.
     */
    String group();

    /**
     * Name used in diagnostics.
     */
    default String name() {
        return getClass().getName();
    }

    /**
     * Create the blueprint for {@code app}. May read the application config; must not register anything itself.
     */
    Blueprint create(WebApplication app);
}
