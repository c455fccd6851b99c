package net.spookly.appurls.routing;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.UUID;

import org.springframework.web.util.UriUtils;

/**
 * Placeholder converters usable in a route rule as {@code <converter:name>}.
 */
public enum PathConverter {
    DEFAULT("[^/]+", false) {
        @Override
        String toText(Object value) {
            return nonEmpty(value);
        }
    },
    STRING("[^/]+", false) {
        @Override
        String toText(Object value) {
            return nonEmpty(value);
        }
    },
    INT("\\d+", false) {
        @Override
        String toText(Object value) {
            long number;
            if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
                number = ((Number) value).longValue();
            } else {
                try {
                    number = Long.parseLong(value.toString().trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("not an integer: " + value, e);
                }
            }
            if (number < 0) {
                throw new IllegalArgumentException("negative integer: " + value);
            }
            return Long.toString(number);
        }
    },
    FLOAT("\\d+\\.\\d+", false) {
        @Override
        String toText(Object value) {
            double number;
            if (value instanceof Number) {
                number = ((Number) value).doubleValue();
            } else {
                try {
                    number = Double.parseDouble(value.toString().trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("not a number: " + value, e);
                }
            }
            if (number < 0 || Double.isNaN(number) || Double.isInfinite(number)) {
                throw new IllegalArgumentException("not a non-negative finite number: " + value);
            }
            String plain = BigDecimal.valueOf(number).toPlainString();
            return plain.contains(".") ? plain : plain + ".0";
        }
    },
    UUID_VALUE("[A-Fa-f0-9]{8}-[A-Fa-f0-9]{4}-[A-Fa-f0-9]{4}-[A-Fa-f0-9]{4}-[A-Fa-f0-9]{12}", false) {
        @Override
        String toText(Object value) {
            if (value instanceof UUID) {
                return value.toString();
            }
            try {
                return UUID.fromString(value.toString().trim()).toString();
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("not a uuid: " + value, e);
            }
        }
    },
    PATH("[^/].*?", true) {
        @Override
        String toText(Object value) {
            return nonEmpty(value);
        }
    };

    private final String regex;
    private final boolean keepsSlashes;

    PathConverter(String regex, boolean keepsSlashes) {
        this.regex = regex;
        this.keepsSlashes = keepsSlashes;
    }

    /**
     * Resolve a converter by the name used in rules ({@code int}, {@code path}, ...).
     */
    public static PathConverter forName(String name) {
        if (name == null || name.isEmpty()) {
            return DEFAULT;
        }
        switch (name.toLowerCase(Locale.ROOT)) {
            case "default":
                return DEFAULT;
            case "string":
                return STRING;
            case "int":
                return INT;
            case "float":
                return FLOAT;
            case "uuid":
                return UUID_VALUE;
            case "path":
                return PATH;
            default:
                throw new IllegalArgumentException("unknown converter: " + name);
        }
    }

    String regex() {
        return regex;
    }

    /**
     * Convert a placeholder value to its encoded URL form, rejecting values the converter cannot represent.
     */
    String toUrl(Object value) {
        String text = toText(value);
        return keepsSlashes
                ? UriUtils.encodePath(text, StandardCharsets.UTF_8)
                : UriUtils.encodePathSegment(text, StandardCharsets.UTF_8);
    }

    abstract String toText(Object value);

    private static String nonEmpty(Object value) {
        String text = value.toString();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("empty value");
        }
        return text;
    }
}
