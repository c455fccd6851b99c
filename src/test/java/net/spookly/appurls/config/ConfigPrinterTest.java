package net.spookly.appurls.config;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.Test;

class ConfigPrinterTest {
    @Test
    void redactsSensitiveValues() {
        AppConfig config = new AppConfig(Map.of(
                "SITE_UI_URL", "https://main.example.org",
                "SECRET_KEY", "s3cr3t",
                "mail", Map.of("password", "hunter2", "host", "smtp.example.org")
        ));

        String yaml = ConfigPrinter.toYaml(config);

        assertTrue(yaml.contains("SITE_UI_URL"));
        assertTrue(yaml.contains("https://main.example.org"));
        assertTrue(yaml.contains("host: smtp.example.org"));
        assertTrue(yaml.contains("<redacted>"));
        assertFalse(yaml.contains("s3cr3t"));
        assertFalse(yaml.contains("hunter2"));
    }
}
