package net.spookly.appurls.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class ConfigReferencesTest {
    private static final Map<String, Object> URLS = Map.of(
            "appPrefixKey", "SITE_UI_URL",
            "otherAppPrefixKey", "SITE_API_URL",
            "otherAppGroups", List.of("env:NOT_A_REFERENCE")
    );

    @Test
    void resolvesBaseUrlsAndBlueprintPrefixes() {
        Map<String, String> env = Map.of("UI_URL", " https://main.example.org\n", "UPLOADS", "/uploads");
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("SITE_UI_URL", "env:UI_URL");
        values.put("SITE_API_URL", "https://archive.example.org");
        values.put(AppConfig.BLUEPRINTS_URL_PREFIXES, Map.of("records", "env:UPLOADS"));
        values.put(AppConfig.URLS, URLS);

        Map<String, Object> resolved = ConfigReferences.resolve(values, null, env::get);

        assertEquals("https://main.example.org", resolved.get("SITE_UI_URL"));
        assertEquals("https://archive.example.org", resolved.get("SITE_API_URL"));
        assertEquals(Map.of("records", "/uploads"), resolved.get(AppConfig.BLUEPRINTS_URL_PREFIXES));
        assertEquals(URLS, resolved.get(AppConfig.URLS));
    }

    @Test
    void reportsEveryUnresolvedReference() throws IOException {
        Path tempDir = Files.createTempDirectory("appurls-refs");
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("SITE_UI_URL", "env:UI_URL");
        values.put("SECRET_KEY", "path:missing/site_secret");
        values.put(AppConfig.BLUEPRINTS_URL_PREFIXES, Map.of("records", "env:"));

        ConfigException exception = assertThrows(ConfigException.class,
                () -> ConfigReferences.resolve(values, tempDir, key -> null));

        String message = exception.getMessage();
        assertTrue(message.startsWith("Unresolved config references:"));
        assertTrue(message.contains("SITE_UI_URL: environment variable UI_URL is not set"));
        assertTrue(message.contains("SECRET_KEY: cannot read"));
        assertTrue(message.contains("BLUEPRINTS_URL_PREFIXES.records: env reference names no variable"));
    }

    @Test
    void referencedBaseUrlMustBeAbsolute() throws IOException {
        Path tempDir = Files.createTempDirectory("appurls-refs");
        Files.writeString(tempDir.resolve("api_url"), "archive.example.org\n", StandardCharsets.UTF_8);
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("SITE_UI_URL", "https://main.example.org");
        values.put("SITE_API_URL", "path:api_url");
        values.put(AppConfig.URLS, URLS);

        ConfigException exception = assertThrows(ConfigException.class,
                () -> ConfigReferences.resolve(values, tempDir, key -> null));

        assertTrue(exception.getMessage().contains(
                "SITE_API_URL: path:api_url resolved to 'archive.example.org', which is not an absolute http(s) URL"));
    }

    @Test
    void literalValuesAreLeftAlone() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("SITE_UI_URL", "main.example.org");
        values.put("PORT", 5000);
        values.put(AppConfig.URLS, URLS);

        Map<String, Object> resolved = ConfigReferences.resolve(values, null, key -> null);

        assertEquals(values, resolved);
    }
}
