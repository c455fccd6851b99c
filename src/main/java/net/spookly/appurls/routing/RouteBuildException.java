package net.spookly.appurls.routing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * No route of a table can produce a URL for the endpoint, values and method given.
 */
public class RouteBuildException extends RuntimeException {
    private final String endpoint;
    private final Map<String, ?> values;
    private final String method;

    public RouteBuildException(String endpoint, Map<String, ?> values, String method, String reason) {
        super(message(endpoint, values, method, reason));
        this.endpoint = endpoint;
        this.values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(values));
        this.method = method;
    }

    public String endpoint() {
        return endpoint;
    }

    public Map<String, ?> values() {
        return values;
    }

    public String method() {
        return method;
    }

    private static String message(String endpoint, Map<String, ?> values, String method, String reason) {
        StringBuilder builder = new StringBuilder("Could not build url for endpoint '")
                .append(endpoint)
                .append('\'');
        if (values != null && !values.isEmpty()) {
            Set<String> keys = new TreeSet<>();
            for (String key : values.keySet()) {
                keys.add(String.valueOf(key));
            }
            builder.append(" with values ").append(keys);
        }
        if (method != null) {
            builder.append(" and method ").append(method);
        }
        if (reason != null) {
            builder.append(": ").append(reason);
        }
        return builder.toString();
    }
}
