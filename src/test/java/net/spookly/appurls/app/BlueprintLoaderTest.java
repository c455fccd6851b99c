package net.spookly.appurls.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import net.spookly.appurls.config.AppConfig;
import org.junit.jupiter.api.Test;

class BlueprintLoaderTest {
    @Test
    void loadsOnlyProvidersOfRequestedGroups() {
        WebApplication app = new WebApplication("api", new AppConfig());

        List<Blueprint> loaded = BlueprintLoader.serviceLoader().load(app, List.of(TestProviders.API_GROUP));

        Set<String> names = loaded.stream().map(Blueprint::name).collect(Collectors.toSet());
        assertEquals(Set.of("search", "records_api", "shared"), names);
        assertTrue(app.routeTable().hasEndpoint("search.results"));
        assertTrue(app.routeTable().hasEndpoint("records_api.read"));
        assertFalse(app.routeTable().hasEndpoint("records.detail"));
    }

    @Test
    void missingGroupIsFatal() {
        WebApplication app = new WebApplication("api", new AppConfig());

        BlueprintLoadException error = assertThrows(BlueprintLoadException.class,
                () -> BlueprintLoader.serviceLoader().load(app, List.of("test.unknown_group")));

        assertTrue(error.getMessage().contains("test.unknown_group"));
    }

    @Test
    void failingProviderIsFatal() {
        WebApplication app = new WebApplication("api", new AppConfig());

        BlueprintLoadException error = assertThrows(BlueprintLoadException.class,
                () -> BlueprintLoader.serviceLoader().load(app, List.of(TestProviders.BROKEN_GROUP)));

        assertTrue(error.getMessage().contains(TestProviders.Broken.class.getName()));
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void duplicateBlueprintAcrossProvidersIsFatal() {
        WebApplication app = new WebApplication("api", new AppConfig());
        BlueprintLoader loader = BlueprintLoader.of(List.of(new TestProviders.SharedUi(), new SharedUiAgain()));

        BlueprintLoadException error = assertThrows(BlueprintLoadException.class,
                () -> loader.load(app, List.of(TestProviders.UI_GROUP)));

        assertTrue(error.getMessage().contains("shared"));
    }

    @Test
    void fixedProviderListBypassesDiscovery() {
        WebApplication app = new WebApplication("ui", new AppConfig());
        BlueprintLoader loader = BlueprintLoader.of(List.of(new TestProviders.RecordsUi()));

        loader.load(app, List.of(TestProviders.UI_GROUP, TestProviders.UI_GROUP));

        assertEquals(Set.of("records"), app.blueprintNames());
        assertEquals("records.detail {id=7}", app.dispatch("GET", "/records/7"));
    }

    private static final class SharedUiAgain implements BlueprintProvider {
        @Override
        public String group() {
            return TestProviders.UI_GROUP;
        }

        @Override
        public Blueprint create(WebApplication app) {
            return new Blueprint("shared").route("/again", "again", context -> "again");
        }
    }
}
