package net.spookly.appurls.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Renders the effective configuration with sensitive values redacted.
 */
public final class ConfigPrinter {
    private static final String REDACTED = "<redacted>";
    private static final Pattern SENSITIVE_KEY =
            Pattern.compile("(?i).*(secret|password|passwd|token|credential|private_key).*");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigPrinter() {
    }

    @SuppressWarnings("unchecked")
    public static String toYaml(AppConfig config) {
        Map<String, Object> data = MAPPER.convertValue(config.snapshot(), Map.class);
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        Yaml yaml = new Yaml(options);
        return yaml.dump(redact(data));
    }

    private static Object redact(Object value) {
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                Object key = entry.getKey();
                if (key != null && SENSITIVE_KEY.matcher(key.toString()).matches() && entry.getValue() != null) {
                    copy.put(key, REDACTED);
                } else {
                    copy.put(key, redact(entry.getValue()));
                }
            }
            return copy;
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<?>) value) {
                copy.add(redact(item));
            }
            return copy;
        }
        return value;
    }
}
