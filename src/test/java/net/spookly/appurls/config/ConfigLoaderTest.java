package net.spookly.appurls.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class ConfigLoaderTest {
    @Test
    void createsDefaultConfigWhenMissing() throws IOException {
        Path tempDir = Files.createTempDirectory("appurls-config");
        Path configPath = tempDir.resolve("conf").resolve("appurls.yaml");

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));

        assertTrue(Files.exists(configPath));
        String content = Files.readString(configPath, StandardCharsets.UTF_8);
        assertTrue(content.contains("urls:"));
        assertTrue(content.contains("SITE_UI_URL"));
        assertTrue(exception.getMessage().contains("generated default"));
    }

    @Test
    void generatedDefaultLoads() throws IOException {
        Path tempDir = Files.createTempDirectory("appurls-config");
        Path configPath = tempDir.resolve("appurls.yaml");
        Files.writeString(configPath,
                ConfigDefaults.defaultYaml("https://main.example.org", "https://archive.example.org"),
                StandardCharsets.UTF_8);

        AppConfig config = ConfigLoader.load(configPath);

        assertEquals("https://main.example.org", config.getString("SITE_UI_URL"));
        UrlsSettings urls = config.section(AppConfig.URLS, UrlsSettings.class).orElseThrow();
        assertEquals("SITE_UI_URL", urls.appPrefixKey);
        assertEquals("SITE_API_URL", urls.otherAppPrefixKey);
        assertEquals(List.of("appurls.api_blueprints"), urls.otherAppGroups);
        assertEquals(Map.of(), config.blueprintUrlPrefixes());
    }

    @Test
    void expandsPathValuesRelativeToConfig() throws IOException {
        Path tempDir = Files.createTempDirectory("appurls-config");
        Path configPath = tempDir.resolve("appurls.yaml");
        Path secretPath = tempDir.resolve("secret").resolve("site_secret");
        Files.createDirectories(secretPath.getParent());
        Files.writeString(secretPath, "s3cr3t\n", StandardCharsets.UTF_8);
        Files.writeString(configPath, """
                SITE_UI_URL: https://main.example.org
                SECRET_KEY: path:secret/site_secret
                BLUEPRINTS_URL_PREFIXES:
                  records: /uploads
                """, StandardCharsets.UTF_8);

        AppConfig config = ConfigLoader.load(configPath);

        assertEquals("s3cr3t", config.getString("SECRET_KEY"));
        assertEquals(Map.of("records", "/uploads"), config.blueprintUrlPrefixes());
    }

    @Test
    void rejectsEmptyAndNonMappingFiles() throws IOException {
        Path tempDir = Files.createTempDirectory("appurls-config");
        Path empty = tempDir.resolve("empty.yaml");
        Path list = tempDir.resolve("list.yaml");
        Files.writeString(empty, "", StandardCharsets.UTF_8);
        Files.writeString(list, "- a\n- b\n", StandardCharsets.UTF_8);

        assertTrue(assertThrows(ConfigException.class, () -> ConfigLoader.load(empty)).getMessage().contains("empty"));
        assertTrue(assertThrows(ConfigException.class, () -> ConfigLoader.load(list)).getMessage().contains("mapping"));
    }

    @Test
    void reportsValidationErrors() throws IOException {
        Path tempDir = Files.createTempDirectory("appurls-config");
        Path configPath = tempDir.resolve("appurls.yaml");
        Files.writeString(configPath, """
                urls:
                  appPrefixKey: SITE_UI_URL
                  otherAppGroups: []
                """, StandardCharsets.UTF_8);

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));

        assertTrue(exception.getMessage().contains("urls.otherAppPrefixKey is required"));
        assertTrue(exception.getMessage().contains("urls.otherAppGroups must include at least one group"));
    }
}
