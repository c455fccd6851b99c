package net.spookly.appurls.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class ConfigValidator {
    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     */
    public static void validate(AppConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateBlueprintPrefixes(config, errors);
        validateUrls(config, errors);

        throwIfErrors(errors);
    }

    private static void validateBlueprintPrefixes(AppConfig config, List<String> errors) {
        Optional<Object> raw = config.find(AppConfig.BLUEPRINTS_URL_PREFIXES);
        if (raw.isEmpty()) {
            return;
        }
        if (!(raw.get() instanceof Map)) {
            errors.add(AppConfig.BLUEPRINTS_URL_PREFIXES + " must be a mapping of blueprint name to prefix");
            return;
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) raw.get()).entrySet()) {
            String field = AppConfig.BLUEPRINTS_URL_PREFIXES + "." + entry.getKey();
            Object value = entry.getValue();
            if (!(value instanceof String)) {
                errors.add(field + " must be a string");
                continue;
            }
            String prefix = (String) value;
            if (!prefix.isEmpty() && !prefix.startsWith("/")) {
                errors.add(field + " must be empty or start with '/'");
            }
        }
    }

    private static void validateUrls(AppConfig config, List<String> errors) {
        Optional<UrlsSettings> section;
        try {
            section = config.section(AppConfig.URLS, UrlsSettings.class);
        } catch (ConfigException e) {
            errors.add(AppConfig.URLS + " section is malformed: " + rootMessage(e));
            return;
        }
        if (section.isEmpty()) {
            return;
        }
        UrlsSettings urls = section.get();
        requireNonBlank(errors, urls.appPrefixKey, "urls.appPrefixKey");
        requireNonBlank(errors, urls.otherAppPrefixKey, "urls.otherAppPrefixKey");
        if (!isBlank(urls.appPrefixKey) && urls.appPrefixKey.equals(urls.otherAppPrefixKey)) {
            errors.add("urls.appPrefixKey and urls.otherAppPrefixKey must name different keys");
        }
        if (urls.otherAppGroups == null || urls.otherAppGroups.isEmpty()) {
            errors.add("urls.otherAppGroups must include at least one group");
        } else {
            requireNoBlankEntries(errors, urls.otherAppGroups, "urls.otherAppGroups");
        }
        if (urls.appGroups != null) {
            requireNoBlankEntries(errors, urls.appGroups, "urls.appGroups");
        }
    }

    private static void requireNonBlank(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        }
    }

    private static void requireNoBlankEntries(List<String> errors, List<String> values, String field) {
        for (String value : values) {
            if (isBlank(value)) {
                errors.add(field + " must not include blank entries");
                return;
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        String message = current.getMessage();
        if (message == null) {
            return current.getClass().getSimpleName();
        }
        int lineBreak = message.indexOf('\n');
        return lineBreak < 0 ? message : message.substring(0, lineBreak);
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
