package net.spookly.appurls.config;

/**
 * Default configuration template written when no config file exists.
 */
public final class ConfigDefaults {
    private static final String DEFAULT_YAML_TEMPLATE = """
            # Generated default appurls config.
            # External base URLs, looked up on every URL build.
            SITE_UI_URL: %s
            SITE_API_URL: %s

            # Optional URL prefix overrides keyed by blueprint name.
            BLUEPRINTS_URL_PREFIXES: {}

            urls:
              appPrefixKey: SITE_UI_URL
              otherAppPrefixKey: SITE_API_URL
              appGroups: ["appurls.ui_blueprints"]
              otherAppGroups: ["appurls.api_blueprints"]
            """;

    private ConfigDefaults() {
    }

    /**
     * Render the default configuration template for the given UI and API base URLs.
     */
    public static String defaultYaml(String uiBaseUrl, String apiBaseUrl) {
        if (uiBaseUrl == null || uiBaseUrl.isBlank() || apiBaseUrl == null || apiBaseUrl.isBlank()) {
            throw new ConfigException("Base URLs are required for the default config");
        }
        return DEFAULT_YAML_TEMPLATE.formatted(uiBaseUrl, apiBaseUrl);
    }
}
