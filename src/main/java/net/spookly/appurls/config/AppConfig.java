package net.spookly.appurls.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Process-wide application configuration: top-level keys mapped to YAML scalars, lists or maps.
 * Reads always see the latest {@link #set} so callers may look values up on every use.
 */
public final class AppConfig {
    public static final String BLUEPRINTS_URL_PREFIXES = "BLUEPRINTS_URL_PREFIXES";
    public static final String URLS = "urls";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private final Map<String, Object> values = new ConcurrentHashMap<>();

    public AppConfig() {
    }

    public AppConfig(Map<String, ?> initial) {
        if (initial != null) {
            initial.forEach(this::set);
        }
    }

    /**
     * Value for {@code key}.
     *
     * @throws ConfigException when the key is not set
     */
    public Object get(String key) {
        Object value = values.get(key);
        if (value == null) {
            throw new ConfigException("Missing config key: " + key);
        }
        return value;
    }

    /**
     * Scalar value for {@code key} rendered as a string.
     *
     * @throws ConfigException when the key is not set or holds a list or map
     */
    public String getString(String key) {
        Object value = get(key);
        if (value instanceof Map || value instanceof Iterable) {
            throw new ConfigException("Config key " + key + " must be a scalar value");
        }
        return value.toString();
    }

    public Optional<Object> find(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(values.get(key));
    }

    public boolean contains(String key) {
        return key != null && values.containsKey(key);
    }

    /**
     * Set or, for a null value, remove a key.
     */
    public void set(String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new ConfigException("Config key is required");
        }
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }

    /**
     * Per-blueprint URL prefix overrides; empty when the key is unset.
     */
    public Map<String, String> blueprintUrlPrefixes() {
        Object raw = values.get(BLUEPRINTS_URL_PREFIXES);
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map)) {
            throw new ConfigException(BLUEPRINTS_URL_PREFIXES + " must be a mapping of blueprint name to prefix");
        }
        Map<String, String> prefixes = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) raw).entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                prefixes.put(entry.getKey().toString(), entry.getValue().toString());
            }
        }
        return Collections.unmodifiableMap(prefixes);
    }

    /**
     * Convert a mapping value into a typed section; empty when the key is unset.
     */
    public <T> Optional<T> section(String key, Class<T> type) {
        Object raw = values.get(key);
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.convertValue(raw, type));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Failed to parse config section: " + key, e);
        }
    }

    /**
     * Copy of all values, sorted by key.
     */
    public Map<String, Object> snapshot() {
        return new TreeMap<>(values);
    }
}
