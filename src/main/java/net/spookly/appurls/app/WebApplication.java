package net.spookly.appurls.app;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import net.spookly.appurls.config.AppConfig;
import net.spookly.appurls.routing.Route;
import net.spookly.appurls.routing.RouteMatch;
import net.spookly.appurls.routing.RouteTable;
import net.spookly.appurls.urls.UrlsBuilder;
import net.spookly.appurls.urls.UrlsBuilderFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A live web application: routes and their handlers, blueprints, config and the attached URL builder.
 * <p>
 * Setup methods may only be called while the application is being assembled; once it serves its first
 * request (or {@link #startServing()} is called) the route table and URL builder are fixed.
 */
public final class WebApplication {
    private static final Logger log = LoggerFactory.getLogger(WebApplication.class);

    private final String name;
    private final AppConfig config;
    private final Map<String, RouteHandler> handlers = new ConcurrentHashMap<>();
    private final Map<String, Blueprint> blueprints = new LinkedHashMap<>();
    private volatile RouteTable routeTable = RouteTable.empty();
    private volatile UrlsBuilder urls;
    private volatile boolean serving;

    public WebApplication(String name, AppConfig config) {
        this.name = Objects.requireNonNull(name, "name");
        this.config = Objects.requireNonNull(config, "config");
    }

    public String name() {
        return name;
    }

    public AppConfig config() {
        return config;
    }

    /**
     * Current route table snapshot.
     */
    public RouteTable routeTable() {
        return routeTable;
    }

    public synchronized Set<String> blueprintNames() {
        return Set.copyOf(blueprints.keySet());
    }

    public boolean isServing() {
        return serving;
    }

    /**
     * Register a route. A null or empty method set means GET; HEAD follows GET and OPTIONS is always allowed.
     */
    public synchronized void addRoute(String rule, String endpoint, Collection<String> methods, RouteHandler handler) {
        requireSetupPhase("addRoute");
        Objects.requireNonNull(handler, "handler");
        RouteHandler existing = handlers.get(endpoint);
        if (existing != null && existing != handler) {
            throw new IllegalStateException("Handler mapping is overwriting an existing endpoint: " + endpoint);
        }
        Route route = new Route(rule, endpoint, effectiveMethods(methods));
        routeTable = routeTable.with(route);
        handlers.put(endpoint, handler);
    }

    /**
     * Register every route of a blueprint. The prefix comes from {@code BLUEPRINTS_URL_PREFIXES} when the
     * config names the blueprint, otherwise from the blueprint itself.
     */
    public synchronized void registerBlueprint(Blueprint blueprint) {
        requireSetupPhase("registerBlueprint");
        Objects.requireNonNull(blueprint, "blueprint");
        if (blueprints.containsKey(blueprint.name())) {
            throw new IllegalStateException("A blueprint named " + blueprint.name() + " is already registered");
        }
        Map<String, String> overrides = config.blueprintUrlPrefixes();
        String prefix = overrides.containsKey(blueprint.name())
                ? overrides.get(blueprint.name())
                : blueprint.urlPrefix();
        for (Blueprint.Definition definition : blueprint.definitions()) {
            addRoute(
                    joinRule(prefix, definition.rule()),
                    blueprint.name() + "." + definition.endpoint(),
                    definition.methods(),
                    definition.handler()
            );
        }
        blueprints.put(blueprint.name(), blueprint);
        log.debug("Registered blueprint {} with {} routes under prefix {}",
                blueprint.name(), blueprint.definitions().size(), prefix);
    }

    /**
     * Create and attach the URL builder. Allowed once, during assembly.
     */
    public synchronized UrlsBuilder installUrls(UrlsBuilderFactory factory) {
        requireSetupPhase("installUrls");
        Objects.requireNonNull(factory, "factory");
        if (urls != null) {
            throw new IllegalStateException("A URL builder is already installed on " + name);
        }
        UrlsBuilder created = Objects.requireNonNull(factory.create(this), "factory returned no URL builder");
        urls = created;
        return created;
    }

    /**
     * The attached URL builder.
     *
     * @throws IllegalStateException when none has been installed
     */
    public UrlsBuilder urls() {
        UrlsBuilder current = urls;
        if (current == null) {
            throw new IllegalStateException("No URL builder installed on " + name);
        }
        return current;
    }

    /**
     * Absolute URL for an endpoint of this application or of the cooperating one.
     */
    public String urlFor(String endpoint, Map<String, ?> values) {
        return urlFor(endpoint, values, null);
    }

    public String urlFor(String endpoint, Map<String, ?> values, String method) {
        return urls().build(endpoint, values == null ? Map.of() : values, method);
    }

    /**
     * Freeze the setup phase.
     */
    public void startServing() {
        if (!serving) {
            serving = true;
            log.info("Application {} serving {} routes", name, routeTable.size());
        }
    }

    /**
     * Route a request to its handler and return the response body.
     *
     * @throws RouteMatchException with status 404 or 405 when no route accepts the request
     */
    public String dispatch(String method, String path) {
        startServing();
        String normalizedMethod = method == null ? "GET" : method.toUpperCase(Locale.ROOT);
        RouteTable table = routeTable;
        Optional<RouteMatch> match = table.match(path, normalizedMethod);
        if (match.isEmpty()) {
            Set<String> allowed = table.allowedMethods(path);
            if (!allowed.isEmpty()) {
                throw new RouteMatchException(RouteMatchException.METHOD_NOT_ALLOWED,
                        normalizedMethod + " not allowed for " + path + ", allowed: " + allowed);
            }
            throw new RouteMatchException(RouteMatchException.NOT_FOUND, "No route matches " + path);
        }
        RouteHandler handler = handlers.get(match.get().endpoint());
        return handler.handle(new RequestContext(this, normalizedMethod, path, match.get()));
    }

    static String joinRule(String prefix, String rule) {
        if (prefix == null) {
            return rule;
        }
        if (rule == null || rule.isEmpty()) {
            return prefix;
        }
        return stripTrailingSlashes(prefix) + "/" + stripLeadingSlashes(rule);
    }

    private static Set<String> effectiveMethods(Collection<String> methods) {
        Set<String> effective = new LinkedHashSet<>();
        if (methods == null || methods.isEmpty()) {
            effective.add("GET");
        } else {
            for (String method : methods) {
                effective.add(method.toUpperCase(Locale.ROOT));
            }
        }
        if (effective.contains("GET")) {
            effective.add("HEAD");
        }
        effective.add("OPTIONS");
        return effective;
    }

    private void requireSetupPhase(String operation) {
        if (serving) {
            throw new IllegalStateException(operation + " called on " + name + " after it started serving requests");
        }
    }

    private static String stripTrailingSlashes(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }

    private static String stripLeadingSlashes(String value) {
        int start = 0;
        while (start < value.length() && value.charAt(start) == '/') {
            start++;
        }
        return value.substring(start);
    }
}
