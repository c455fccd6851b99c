package net.spookly.appurls.routing;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;

/**
 * A rule bound to an endpoint name. Routes never carry a handler; dispatch targets are owned by the application.
 */
@Getter
@Accessors(fluent = true)
public final class Route {
    private final RoutePattern pattern;
    private final String endpoint;
    /**
     * Upper-case HTTP methods the route accepts; empty means any method.
     */
    private final Set<String> methods;

    public Route(String rule, String endpoint) {
        this(rule, endpoint, Set.of());
    }

    public Route(@NonNull String rule, @NonNull String endpoint, Collection<String> methods) {
        if (endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint is required for rule: " + rule);
        }
        this.pattern = RoutePattern.parse(rule);
        this.endpoint = endpoint;
        Set<String> normalized = new TreeSet<>();
        if (methods != null) {
            for (String method : methods) {
                if (method != null && !method.isBlank()) {
                    normalized.add(method.trim().toUpperCase(Locale.ROOT));
                }
            }
        }
        this.methods = Collections.unmodifiableSet(normalized);
    }

    public String rule() {
        return pattern.rule();
    }

    /**
     * True when {@code method} is null (no filter) or accepted by this route.
     */
    public boolean allowsMethod(String method) {
        return method == null || methods.isEmpty() || methods.contains(method.toUpperCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return pattern.rule() + " -> " + endpoint + (methods.isEmpty() ? "" : " " + methods);
    }
}
