package net.spookly.appurls.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Collects non-fatal configuration warnings (for example, a base URL that is not absolute).
 */
public final class ConfigWarnings {
    private ConfigWarnings() {
    }

    public static List<String> collect(AppConfig config) {
        List<String> warnings = new ArrayList<>();
        if (config == null) {
            return warnings;
        }
        Optional<UrlsSettings> urls = config.section(AppConfig.URLS, UrlsSettings.class);
        if (urls.isEmpty()) {
            return warnings;
        }
        warnOnPrefix(warnings, config, "urls.appPrefixKey", urls.get().appPrefixKey);
        warnOnPrefix(warnings, config, "urls.otherAppPrefixKey", urls.get().otherAppPrefixKey);
        if (urls.get().appGroups == null || urls.get().appGroups.isEmpty()) {
            warnings.add("urls.appGroups is empty; the application registers no blueprints from providers");
        }
        return warnings;
    }

    private static void warnOnPrefix(List<String> warnings, AppConfig config, String field, String key) {
        if (key == null || key.isBlank()) {
            return;
        }
        Optional<Object> value = config.find(key);
        if (value.isEmpty()) {
            warnings.add(field + " refers to " + key + " which is not set; URL builds will fail until it is");
            return;
        }
        String prefix = value.get().toString();
        if (!isAbsoluteHttpUrl(prefix)) {
            warnings.add(key + " is not an absolute http(s) URL: " + prefix);
        }
        if (prefix.endsWith("/")) {
            warnings.add(key + " ends with '/'; built URLs will contain a double slash");
        }
    }

    static boolean isAbsoluteHttpUrl(String value) {
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null) {
                return false;
            }
            String normalized = scheme.toLowerCase(Locale.ROOT);
            return normalized.equals("http") || normalized.equals("https");
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
