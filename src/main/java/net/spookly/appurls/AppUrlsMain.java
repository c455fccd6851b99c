package net.spookly.appurls;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

import net.spookly.appurls.app.BlueprintLoader;
import net.spookly.appurls.app.WebApplication;
import net.spookly.appurls.config.AppConfig;
import net.spookly.appurls.config.ConfigException;
import net.spookly.appurls.config.ConfigLoader;
import net.spookly.appurls.config.ConfigPrinter;
import net.spookly.appurls.config.ConfigWarnings;
import net.spookly.appurls.config.UrlsSettings;
import net.spookly.appurls.routing.Route;
import net.spookly.appurls.urls.AppsUrlsBuilder;
import net.spookly.appurls.urls.SetupOptions;

/**
 * Command line entry point: assembles the configured application and resolves one endpoint to its URL.
 */
public final class AppUrlsMain {
    private static final String DEFAULT_CONFIG = "config/appurls.yaml";

    private AppUrlsMain() {
    }

    public static void main(String[] args) {
        CliOptions options = parseArgs(args);
        AppConfig config = ConfigLoader.load(options.configPath);
        for (String warning : ConfigWarnings.collect(config)) {
            System.err.println("Config warning: " + warning);
        }
        if (options.printEffectiveConfig) {
            System.out.println(ConfigPrinter.toYaml(config));
            return;
        }
        if (options.dryRun) {
            System.out.println("Config OK (--dry-run).");
            return;
        }

        WebApplication app = assemble(config, BlueprintLoader.serviceLoader());
        if (options.listRoutes) {
            for (Route route : app.routeTable().routes()) {
                System.out.println(route);
            }
            return;
        }
        if (options.endpoint == null) {
            System.err.println("Usage: appurls [--config <file>] --endpoint <name> [--param key=value]... [--method <method>]");
            System.exit(2);
            return;
        }
        System.out.println(app.urlFor(options.endpoint, options.params, options.method));
    }

    /**
     * Build the application from {@code urls.appGroups} and attach a builder that mirrors {@code urls.otherAppGroups}.
     */
    static WebApplication assemble(AppConfig config, BlueprintLoader loader) {
        UrlsSettings urls = config.section(AppConfig.URLS, UrlsSettings.class)
                .orElseThrow(() -> new ConfigException("urls section is required"));
        WebApplication app = new WebApplication("appurls", config);
        if (urls.appGroups != null && !urls.appGroups.isEmpty()) {
            loader.load(app, urls.appGroups);
        }
        app.installUrls(AppsUrlsBuilder.factory(
                urls.appPrefixKey,
                urls.otherAppPrefixKey,
                urls.otherAppGroups,
                SetupOptions.withLoader(loader)
        ));
        app.startServing();
        return app;
    }

    static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean printEffectiveConfig = false;
        boolean listRoutes = false;
        String endpoint = null;
        String method = null;
        Map<String, String> params = new LinkedHashMap<>();
        if (args == null) {
            return new CliOptions(configPath, dryRun, printEffectiveConfig, listRoutes, endpoint, method, params);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            boolean hasValue = i + 1 < args.length;
            if (("--config".equals(arg) || "-c".equals(arg)) && hasValue) {
                configPath = Paths.get(args[++i]);
            } else if (("--endpoint".equals(arg) || "-e".equals(arg)) && hasValue) {
                endpoint = args[++i];
            } else if (("--method".equals(arg) || "-m".equals(arg)) && hasValue) {
                method = args[++i];
            } else if (("--param".equals(arg) || "-p".equals(arg)) && hasValue) {
                String pair = args[++i];
                int eq = pair.indexOf('=');
                if (eq <= 0) {
                    throw new IllegalArgumentException("--param must be key=value: " + pair);
                }
                params.put(pair.substring(0, eq), pair.substring(eq + 1));
            } else if ("--dry-run".equals(arg)) {
                dryRun = true;
            } else if ("--print-effective-config".equals(arg)) {
                printEffectiveConfig = true;
            } else if ("--list-routes".equals(arg)) {
                listRoutes = true;
            }
        }
        return new CliOptions(configPath, dryRun, printEffectiveConfig, listRoutes, endpoint, method, params);
    }

    record CliOptions(Path configPath,
                      boolean dryRun,
                      boolean printEffectiveConfig,
                      boolean listRoutes,
                      String endpoint,
                      String method,
                      Map<String, String> params) {
    }
}
