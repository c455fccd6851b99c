package net.spookly.appurls.app;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.appurls.routing.RouteMatch;

/**
 * Per-request state handed to handlers; carries the application explicitly instead of a global lookup.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class RequestContext {
    private final WebApplication app;
    private final String method;
    private final String path;
    private final RouteMatch match;

    public String endpoint() {
        return match.endpoint();
    }

    /**
     * Placeholder values extracted from the request path.
     */
    public Map<String, String> values() {
        return match.values();
    }

    /**
     * Absolute URL for an endpoint of this application or of the cooperating one.
     */
    public String urlFor(String endpoint, Map<String, ?> values) {
        return app.urlFor(endpoint, values);
    }

    /**
     * Like {@link #urlFor(String, Map)}, but only routes accepting {@code method} qualify.
     */
    public String urlFor(String endpoint, Map<String, ?> values, String method) {
        return app.urlFor(endpoint, values, method);
    }
}
