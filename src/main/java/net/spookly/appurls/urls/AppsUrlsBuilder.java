package net.spookly.appurls.urls;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import net.spookly.appurls.app.WebApplication;
import net.spookly.appurls.config.AppConfig;
import net.spookly.appurls.routing.RouteBuildException;
import net.spookly.appurls.routing.RouteTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds absolute URLs for the endpoints of the current application and, by falling back to a mirrored
 * route table, for the endpoints of a second application deployed next to it.
 * <p>
 * Both base URLs are read from the application config on every call.
 */
public final class AppsUrlsBuilder implements UrlsBuilder {
    private static final Logger log = LoggerFactory.getLogger(AppsUrlsBuilder.class);

    private final String appPrefixKey;
    private final String otherAppPrefixKey;
    private final List<String> otherAppGroups;
    private volatile WebApplication app;
    private volatile RouteTable mirror;

    /**
     * @param appPrefixKey      config key holding the current application's external base URL
     * @param otherAppPrefixKey config key holding the other application's external base URL
     * @param otherAppGroups    blueprint provider groups that assemble the other application
     */
    public AppsUrlsBuilder(String appPrefixKey, String otherAppPrefixKey, List<String> otherAppGroups) {
        this.appPrefixKey = Objects.requireNonNull(appPrefixKey, "appPrefixKey");
        this.otherAppPrefixKey = Objects.requireNonNull(otherAppPrefixKey, "otherAppPrefixKey");
        this.otherAppGroups = List.copyOf(otherAppGroups);
    }

    /**
     * Factory that creates and sets up a builder for each application, discovering providers with
     * {@link java.util.ServiceLoader}.
     */
    public static UrlsBuilderFactory factory(String appPrefixKey, String otherAppPrefixKey, List<String> otherAppGroups) {
        return factory(appPrefixKey, otherAppPrefixKey, otherAppGroups, SetupOptions.defaults());
    }

    public static UrlsBuilderFactory factory(String appPrefixKey,
                                             String otherAppPrefixKey,
                                             List<String> otherAppGroups,
                                             SetupOptions options) {
        List<String> groups = List.copyOf(otherAppGroups);
        Objects.requireNonNull(options, "options");
        return app -> {
            AppsUrlsBuilder builder = new AppsUrlsBuilder(appPrefixKey, otherAppPrefixKey, groups);
            builder.setup(app, options);
            return builder;
        };
    }

    /**
     * Build the mirrored route table of the other application. Call once, while {@code app} is being assembled.
     */
    public synchronized void setup(WebApplication app, SetupOptions options) {
        Objects.requireNonNull(app, "app");
        Objects.requireNonNull(options, "options");
        if (this.mirror != null) {
            throw new IllegalStateException("URL builder is already set up for " + this.app.name());
        }
        if (app.isServing()) {
            throw new IllegalStateException("URL builder setup must run before " + app.name() + " serves requests");
        }
        RouteTable table = RouteMirror.build(
                otherAppGroups,
                app.config().blueprintUrlPrefixes(),
                options.blueprintLoader()
        );
        this.app = app;
        this.mirror = table;
    }

    /**
     * Mirrored routes of the other application.
     */
    public RouteTable mirror() {
        return requireSetup();
    }

    @Override
    public String build(String endpoint, Map<String, ?> values, String method) {
        RouteTable otherRoutes = requireSetup();
        WebApplication current = app;
        // TODO: cache both prefixes per request once a request-scoped context is available to builders.
        try {
            String path = current.routeTable().build(endpoint, values, method);
            return prefix(current.config(), appPrefixKey) + path;
        } catch (RouteBuildException e) {
            log.debug("Endpoint {} not built by {}, trying mirrored routes: {}", endpoint, current.name(), e.getMessage());
        }
        String path = otherRoutes.build(endpoint, values, method);
        return prefix(current.config(), otherAppPrefixKey) + path;
    }

    private static String prefix(AppConfig config, String key) {
        return config.getString(key);
    }

    private RouteTable requireSetup() {
        RouteTable table = mirror;
        if (table == null) {
            throw new IllegalStateException("URL builder used before setup");
        }
        return table;
    }
}
