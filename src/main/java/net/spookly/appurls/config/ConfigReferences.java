package net.spookly.appurls.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Resolves deployment references in top-level config values and blueprint prefixes.
 * <p>
 * A value {@code env:NAME} is replaced by the environment variable, {@code path:file} by the stripped file content
 * (relative to the config file). Sections such as {@code urls} name other keys and are left untouched. Base URLs
 * named by {@code urls.appPrefixKey} and {@code urls.otherAppPrefixKey} that come from a reference must resolve to
 * an absolute http(s) URL.
 */
final class ConfigReferences {
    private static final String ENV = "env:";
    private static final String PATH = "path:";

    private final Path baseDir;
    private final Function<String, String> environment;
    private final Set<String> baseUrlKeys;
    private final List<String> errors = new ArrayList<>();

    private ConfigReferences(Path baseDir, Function<String, String> environment, Set<String> baseUrlKeys) {
        this.baseDir = baseDir;
        this.environment = environment;
        this.baseUrlKeys = baseUrlKeys;
    }

    static Map<String, Object> resolve(Map<String, Object> values, Path baseDir) {
        return resolve(values, baseDir, System::getenv);
    }

    /**
     * @throws ConfigException listing every reference that could not be resolved
     */
    static Map<String, Object> resolve(Map<String, Object> values, Path baseDir, Function<String, String> environment) {
        ConfigReferences references = new ConfigReferences(baseDir, environment, baseUrlKeys(values));
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            resolved.put(entry.getKey(), references.resolveEntry(entry.getKey(), entry.getValue()));
        }
        if (!references.errors.isEmpty()) {
            throw new ConfigException("Unresolved config references:\n- " + String.join("\n- ", references.errors));
        }
        return resolved;
    }

    private Object resolveEntry(String key, Object value) {
        if (AppConfig.BLUEPRINTS_URL_PREFIXES.equals(key) && value instanceof Map) {
            Map<Object, Object> prefixes = new LinkedHashMap<>();
            for (Map.Entry<?, ?> prefix : ((Map<?, ?>) value).entrySet()) {
                prefixes.put(prefix.getKey(), resolveValue(key + "." + prefix.getKey(), prefix.getValue()));
            }
            return prefixes;
        }
        return resolveValue(key, value);
    }

    private Object resolveValue(String name, Object value) {
        if (!(value instanceof String)) {
            return value;
        }
        String raw = (String) value;
        String resolved;
        if (raw.startsWith(ENV)) {
            resolved = fromEnvironment(name, raw.substring(ENV.length()));
        } else if (raw.startsWith(PATH)) {
            resolved = fromFile(name, raw.substring(PATH.length()));
        } else {
            return value;
        }
        if (resolved == null) {
            return value;
        }
        if (baseUrlKeys.contains(name) && !ConfigWarnings.isAbsoluteHttpUrl(resolved)) {
            errors.add(name + ": " + raw + " resolved to '" + resolved + "', which is not an absolute http(s) URL");
        }
        return resolved;
    }

    private String fromEnvironment(String name, String variable) {
        if (variable.isBlank()) {
            errors.add(name + ": env reference names no variable");
            return null;
        }
        String value = environment.apply(variable);
        if (value == null || value.isBlank()) {
            errors.add(name + ": environment variable " + variable + " is not set");
            return null;
        }
        return value.strip();
    }

    private String fromFile(String name, String location) {
        if (location.isBlank()) {
            errors.add(name + ": path reference names no file");
            return null;
        }
        Path file;
        try {
            Path path = Paths.get(location);
            file = baseDir != null && !path.isAbsolute() ? baseDir.resolve(path).normalize() : path;
        } catch (InvalidPathException e) {
            errors.add(name + ": invalid path " + location);
            return null;
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            errors.add(name + ": cannot read " + file + " (" + e.getMessage() + ")");
            return null;
        }
        if (content.isEmpty()) {
            errors.add(name + ": " + file + " is empty");
            return null;
        }
        return content;
    }

    private static Set<String> baseUrlKeys(Map<String, Object> values) {
        Set<String> keys = new LinkedHashSet<>();
        Object urls = values.get(AppConfig.URLS);
        if (urls instanceof Map) {
            for (String field : List.of("appPrefixKey", "otherAppPrefixKey")) {
                Object key = ((Map<?, ?>) urls).get(field);
                if (key instanceof String) {
                    keys.add((String) key);
                }
            }
        }
        return keys;
    }
}
