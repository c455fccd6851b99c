package net.spookly.appurls.urls;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;

import net.spookly.appurls.app.BlueprintLoadException;
import net.spookly.appurls.app.BlueprintLoader;
import net.spookly.appurls.app.RouteMatchException;
import net.spookly.appurls.app.WebApplication;
import net.spookly.appurls.config.AppConfig;
import net.spookly.appurls.routing.Route;
import net.spookly.appurls.routing.RouteTable;
import org.junit.jupiter.api.Test;

class RouteMirrorTest {
    private static final List<String> API_GROUPS = List.of("test.api_blueprints");

    @Test
    void copiesRulesAndEndpointsOfOtherApplication() {
        RouteTable mirror = RouteMirror.build(API_GROUPS, Map.of(), BlueprintLoader.serviceLoader());

        assertTrue(mirror.hasEndpoint("search.results"));
        assertTrue(mirror.hasEndpoint("records_api.read"));
        assertTrue(mirror.hasEndpoint("shared.ping"));
        assertEquals("/search", mirror.build("search.results", Map.of(), null));
    }

    @Test
    void appliesBlueprintPrefixOverrides() {
        RouteTable mirror = RouteMirror.build(API_GROUPS, Map.of("search", "/find"), BlueprintLoader.serviceLoader());

        assertEquals("/find", mirror.build("search.results", Map.of(), null));
    }

    @Test
    void keepsOnlyRuleAndEndpointOfEachRoute() {
        WebApplication live = new WebApplication("api", new AppConfig());
        BlueprintLoader.serviceLoader().load(live, API_GROUPS);

        RouteTable mirror = RouteMirror.build(API_GROUPS, Map.of(), BlueprintLoader.serviceLoader());

        assertEquals(live.routeTable().size(), mirror.size());
        for (int i = 0; i < mirror.size(); i++) {
            Route liveRoute = live.routeTable().routes().get(i);
            Route mirrored = mirror.routes().get(i);
            assertEquals(liveRoute.rule(), mirrored.rule());
            assertEquals(liveRoute.endpoint(), mirrored.endpoint());
            assertTrue(mirrored.methods().isEmpty(), mirrored.toString());
        }
        assertEquals(Set.of("OPTIONS", "PUT"), live.routeTable().routes().stream()
                .filter(route -> route.endpoint().equals("records_api.update"))
                .findFirst().orElseThrow().methods());
        assertEquals("/records/r1", mirror.build("records_api.update", Map.of("id", "r1"), "GET"));
    }

    @Test
    void mirrorIsNotServedByAnyApplication() {
        RouteTable mirror = RouteMirror.build(API_GROUPS, Map.of(), BlueprintLoader.serviceLoader());
        WebApplication ui = new WebApplication("ui", new AppConfig());
        BlueprintLoader.serviceLoader().load(ui, List.of("test.ui_blueprints"));

        assertTrue(mirror.match("/search", "GET").isPresent());
        RouteMatchException notFound = assertThrows(RouteMatchException.class, () -> ui.dispatch("GET", "/search"));
        assertEquals(RouteMatchException.NOT_FOUND, notFound.status());
    }

    @Test
    void discoveryFailurePropagates() {
        assertThrows(BlueprintLoadException.class,
                () -> RouteMirror.build(List.of("test.broken_blueprints"), Map.of(), BlueprintLoader.serviceLoader()));
        assertThrows(BlueprintLoadException.class,
                () -> RouteMirror.build(List.of("test.missing_blueprints"), Map.of(), BlueprintLoader.serviceLoader()));
    }
}
