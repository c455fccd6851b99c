package net.spookly.appurls.routing;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import org.springframework.web.util.UriUtils;

/**
 * Immutable, ordered set of routes supporting reverse lookup by endpoint name.
 */
public final class RouteTable {
    private static final RouteTable EMPTY = new RouteTable(List.of());
    private static final Comparator<Route> BUILD_ORDER =
            Comparator.comparingInt((Route route) -> route.pattern().arguments().size()).reversed();

    private final List<Route> routes;
    private final Map<String, List<Route>> routesByEndpoint;

    private RouteTable(List<Route> routes) {
        this.routes = routes;
        Map<String, List<Route>> byEndpoint = new LinkedHashMap<>();
        for (Route route : routes) {
            byEndpoint.computeIfAbsent(route.endpoint(), key -> new ArrayList<>()).add(route);
        }
        // Stable sort: among routes with equal placeholder count, registration order wins.
        for (Map.Entry<String, List<Route>> entry : byEndpoint.entrySet()) {
            List<Route> candidates = entry.getValue();
            candidates.sort(BUILD_ORDER);
            entry.setValue(Collections.unmodifiableList(candidates));
        }
        this.routesByEndpoint = Collections.unmodifiableMap(byEndpoint);
    }

    public static RouteTable empty() {
        return EMPTY;
    }

    public static RouteTable of(Collection<Route> routes) {
        if (routes == null || routes.isEmpty()) {
            return EMPTY;
        }
        return new RouteTable(List.copyOf(routes));
    }

    /**
     * Return a new table with {@code route} appended.
     */
    public RouteTable with(Route route) {
        List<Route> copy = new ArrayList<>(routes.size() + 1);
        copy.addAll(routes);
        copy.add(route);
        return new RouteTable(Collections.unmodifiableList(copy));
    }

    /**
     * Routes in registration order.
     */
    public List<Route> routes() {
        return routes;
    }

    public int size() {
        return routes.size();
    }

    public boolean hasEndpoint(String endpoint) {
        return routesByEndpoint.containsKey(endpoint);
    }

    public Set<String> endpoints() {
        return routesByEndpoint.keySet();
    }

    /**
     * Build the relative path (plus query string for unused values) for an endpoint.
     *
     * @throws RouteBuildException when no route of the endpoint accepts the method and values
     */
    public String build(String endpoint, Map<String, ?> values, String method) {
        Map<String, ?> safeValues = values == null ? Map.of() : values;
        for (String key : safeValues.keySet()) {
            if (key == null) {
                throw new RouteBuildException(endpoint, safeValues, method, "values must not contain a null key");
            }
        }
        List<Route> candidates = routesByEndpoint.get(endpoint);
        if (candidates == null) {
            throw new RouteBuildException(endpoint, safeValues, method, "no route registered for endpoint");
        }
        String problem = null;
        for (Route route : candidates) {
            if (!route.allowsMethod(method)) {
                continue;
            }
            String path;
            try {
                path = route.pattern().expand(safeValues);
            } catch (IllegalArgumentException e) {
                problem = e.getMessage();
                continue;
            }
            return path + queryString(route, safeValues);
        }
        if (problem == null) {
            problem = "method " + method + " not allowed";
        }
        throw new RouteBuildException(endpoint, safeValues, method, problem);
    }

    /**
     * Forward lookup: the first route, in registration order, matching both path and method.
     */
    public Optional<RouteMatch> match(String path, String method) {
        for (Route route : routes) {
            if (!route.allowsMethod(method)) {
                continue;
            }
            Optional<Map<String, String>> values = route.pattern().match(path);
            if (values.isPresent()) {
                return Optional.of(new RouteMatch(route, Collections.unmodifiableMap(values.get())));
            }
        }
        return Optional.empty();
    }

    /**
     * Methods accepted by routes whose rule matches {@code path}; {@code *} when a matching route accepts any method.
     */
    public Set<String> allowedMethods(String path) {
        Set<String> allowed = new TreeSet<>();
        for (Route route : routes) {
            if (route.pattern().match(path).isPresent()) {
                if (route.methods().isEmpty()) {
                    allowed.add("*");
                } else {
                    allowed.addAll(route.methods());
                }
            }
        }
        return allowed;
    }

    private static String queryString(Route route, Map<String, ?> values) {
        Set<String> arguments = route.pattern().arguments();
        StringBuilder query = new StringBuilder();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            if (arguments.contains(entry.getKey()) || entry.getValue() == null) {
                continue;
            }
            query.append(query.length() == 0 ? '?' : '&')
                    .append(formParam(entry.getKey()))
                    .append('=')
                    .append(formParam(entry.getValue().toString()));
        }
        return query.toString();
    }

    // Form style: a literal '+' is escaped so that '+' can stand for a space.
    private static String formParam(String text) {
        return UriUtils.encodeQueryParam(text, StandardCharsets.UTF_8)
                .replace("+", "%2B")
                .replace("%20", "+");
    }
}
