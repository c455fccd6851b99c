package net.spookly.appurls.app;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;

/**
 * Named group of routes registered together under an optional URL prefix.
 * Endpoints are registered on the application as {@code <blueprint name>.<endpoint>}.
 */
@Getter
@Accessors(fluent = true)
public final class Blueprint {
    private final String name;
    /**
     * Prefix applied when the application config has no override for this blueprint; null for none.
     */
    private final String urlPrefix;
    private final List<Definition> definitions = new ArrayList<>();

    public Blueprint(String name) {
        this(name, null);
    }

    public Blueprint(@NonNull String name, String urlPrefix) {
        if (name.isBlank() || name.contains(".")) {
            throw new IllegalArgumentException("blueprint name must be non-blank and must not contain '.': " + name);
        }
        this.name = name;
        this.urlPrefix = urlPrefix;
    }

    /**
     * Add a GET route.
     */
    public Blueprint route(String rule, String endpoint, RouteHandler handler) {
        return route(rule, endpoint, null, handler);
    }

    public Blueprint route(@NonNull String rule, @NonNull String endpoint, Collection<String> methods, RouteHandler handler) {
        if (endpoint.isBlank() || endpoint.contains(".")) {
            throw new IllegalArgumentException("endpoint must be non-blank and must not contain '.': " + endpoint);
        }
        Set<String> methodSet = methods == null ? null : Set.copyOf(methods);
        definitions.add(new Definition(rule, endpoint, methodSet, Objects.requireNonNull(handler, "handler")));
        return this;
    }

    public List<Definition> definitions() {
        return Collections.unmodifiableList(definitions);
    }

    /**
     * A route as declared on the blueprint, before prefixing.
     */
    public record Definition(String rule, String endpoint, Set<String> methods, RouteHandler handler) {
    }
}
