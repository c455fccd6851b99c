package net.spookly.appurls.routing;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Forward lookup outcome: the matched route and its raw placeholder values.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class RouteMatch {
    private final Route route;
    private final Map<String, String> values;

    public String endpoint() {
        return route.endpoint();
    }
}
