package net.spookly.appurls.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String DEFAULT_UI_BASE_URL = "https://127.0.0.1:5000";
    private static final String DEFAULT_API_BASE_URL = "https://127.0.0.1:5000/api";

    private ConfigLoader() {
    }

    /**
     * Load and validate the YAML application configuration.
     */
    public static AppConfig load(Path path) {
        if (path == null) {
            throw new ConfigException("Config path is required");
        }
        if (!Files.exists(path)) {
            writeDefaultConfig(path);
            throw new ConfigException("Config file did not exist, generated default at: " + path);
        }
        Object raw;
        Yaml yaml = new Yaml();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            raw = yaml.load(reader);
        } catch (IOException | YAMLException e) {
            throw new ConfigException("Failed to read config: " + path, e);
        }
        if (raw == null) {
            throw new ConfigException("Config file is empty: " + path);
        }
        if (!(raw instanceof Map)) {
            throw new ConfigException("Config root must be a mapping: " + path);
        }
        Map<String, Object> values = toStringKeys((Map<?, ?>) raw, path);
        AppConfig config = new AppConfig(ConfigReferences.resolve(values, path.toAbsolutePath().getParent()));
        ConfigValidator.validate(config);
        log.debug("Loaded config {} with {} keys", path, config.snapshot().size());
        return config;
    }

    private static Map<String, Object> toStringKeys(Map<?, ?> raw, Path path) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (!(entry.getKey() instanceof String)) {
                throw new ConfigException("Config keys must be strings (" + entry.getKey() + "): " + path);
            }
            values.put((String) entry.getKey(), entry.getValue());
        }
        return values;
    }

    private static void writeDefaultConfig(Path path) {
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(
                    path,
                    ConfigDefaults.defaultYaml(DEFAULT_UI_BASE_URL, DEFAULT_API_BASE_URL),
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW
            );
        } catch (IOException e) {
            throw new ConfigException("Failed to write default config: " + path, e);
        }
    }
}
