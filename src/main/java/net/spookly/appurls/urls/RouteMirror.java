package net.spookly.appurls.urls;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import net.spookly.appurls.app.BlueprintLoader;
import net.spookly.appurls.app.WebApplication;
import net.spookly.appurls.config.AppConfig;
import net.spookly.appurls.routing.Route;
import net.spookly.appurls.routing.RouteTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a handler-free copy of another application's routes, for URL building only.
 */
public final class RouteMirror {
    private static final Logger log = LoggerFactory.getLogger(RouteMirror.class);
    private static final String SHELL_NAME = "AppsUrlsBuilder";

    private RouteMirror() {
    }

    /**
     * Assemble a throwaway application from {@code groups} and keep only the rule and endpoint of each route.
     * Runs at setup time and reads no request state.
     *
     * @param blueprintUrlPrefixes prefix overrides of the real application, so both agree on the URL layout
     * @throws net.spookly.appurls.app.BlueprintLoadException when discovery fails
     */
    public static RouteTable build(Collection<String> groups, Map<String, String> blueprintUrlPrefixes, BlueprintLoader loader) {
        AppConfig shellConfig = new AppConfig();
        shellConfig.set(AppConfig.BLUEPRINTS_URL_PREFIXES, Map.copyOf(blueprintUrlPrefixes));
        WebApplication shell = new WebApplication(SHELL_NAME, shellConfig);
        loader.load(shell, groups);

        List<Route> routes = new ArrayList<>(shell.routeTable().size());
        for (Route route : shell.routeTable().routes()) {
            // Method sets are dropped too: a mirrored route builds for any method.
            routes.add(new Route(route.rule(), route.endpoint()));
        }
        RouteTable mirror = RouteTable.of(routes);
        log.info("Mirrored {} routes ({} endpoints) from groups {}", mirror.size(), mirror.endpoints().size(), groups);
        return mirror;
    }
}
