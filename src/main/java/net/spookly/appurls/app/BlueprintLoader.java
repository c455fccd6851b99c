package net.spookly.appurls.app;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers the blueprints of the requested provider groups on an application.
 */
public final class BlueprintLoader {
    private static final Logger log = LoggerFactory.getLogger(BlueprintLoader.class);

    private final Supplier<Iterable<BlueprintProvider>> providers;

    private BlueprintLoader(Supplier<Iterable<BlueprintProvider>> providers) {
        this.providers = providers;
    }

    /**
     * Discover providers with {@link ServiceLoader} on the thread context class loader.
     */
    public static BlueprintLoader serviceLoader() {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        return serviceLoader(classLoader == null ? BlueprintLoader.class.getClassLoader() : classLoader);
    }

    public static BlueprintLoader serviceLoader(ClassLoader classLoader) {
        Objects.requireNonNull(classLoader, "classLoader");
        return new BlueprintLoader(() -> ServiceLoader.load(BlueprintProvider.class, classLoader));
    }

    /**
     * Use a fixed provider list instead of discovery.
     */
    public static BlueprintLoader of(Collection<? extends BlueprintProvider> providers) {
        List<BlueprintProvider> copy = List.copyOf(providers);
        return new BlueprintLoader(() -> copy);
    }

    /**
     * Create and register the blueprints of every provider in {@code groups}, in discovery order.
     *
     * @throws BlueprintLoadException when a group has no provider, or a provider fails or yields no blueprint
     */
    public List<Blueprint> load(WebApplication app, Collection<String> groups) {
        Objects.requireNonNull(app, "app");
        Map<String, List<BlueprintProvider>> byGroup = discover();
        List<Blueprint> loaded = new ArrayList<>();
        for (String group : new LinkedHashSet<>(groups)) {
            List<BlueprintProvider> members = byGroup.get(group);
            if (members == null || members.isEmpty()) {
                throw new BlueprintLoadException("No blueprint providers found for group: " + group);
            }
            for (BlueprintProvider provider : members) {
                Blueprint blueprint = create(provider, app);
                try {
                    app.registerBlueprint(blueprint);
                } catch (IllegalStateException | IllegalArgumentException e) {
                    throw new BlueprintLoadException(
                            "Failed to register blueprint " + blueprint.name() + " from " + provider.name(), e);
                }
                log.debug("Registered blueprint {} from {} ({}) on {}",
                        blueprint.name(), provider.name(), group, app.name());
                loaded.add(blueprint);
            }
        }
        return loaded;
    }

    private Map<String, List<BlueprintProvider>> discover() {
        Map<String, List<BlueprintProvider>> byGroup = new LinkedHashMap<>();
        try {
            for (BlueprintProvider provider : providers.get()) {
                byGroup.computeIfAbsent(provider.group(), key -> new ArrayList<>()).add(provider);
            }
        } catch (ServiceConfigurationError e) {
            throw new BlueprintLoadException("Failed to discover blueprint providers", e);
        }
        return byGroup;
    }

    private static Blueprint create(BlueprintProvider provider, WebApplication app) {
        Blueprint blueprint;
        try {
            blueprint = provider.create(app);
        } catch (RuntimeException e) {
            throw new BlueprintLoadException("Blueprint provider failed: " + provider.name(), e);
        }
        if (blueprint == null) {
            throw new BlueprintLoadException("Blueprint provider returned no blueprint: " + provider.name());
        }
        return blueprint;
    }
}
