package net.spookly.appurls.urls;

import java.util.Map;

/**
 * Produces absolute URLs for endpoints. Applications hold one instance and may swap implementations freely.
 */
@FunctionalInterface
public interface UrlsBuilder {
    /**
     * Build the absolute URL of {@code endpoint}.
     *
     * @param values placeholder values; values the route does not use are appended as query parameters
     * @param method optional HTTP method the route must accept, null for any
     * @throws net.spookly.appurls.routing.RouteBuildException when no known route can be built
     */
    String build(String endpoint, Map<String, ?> values, String method);

    default String build(String endpoint, Map<String, ?> values) {
        return build(endpoint, values, null);
    }
}
