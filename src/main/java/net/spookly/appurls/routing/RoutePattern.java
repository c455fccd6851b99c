package net.spookly.appurls.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed route rule such as {@code /records/<id>} or {@code /files/<path:name>}.
 */
public final class RoutePattern {
    private static final Pattern PLACEHOLDER =
            Pattern.compile("<(?:([A-Za-z_][A-Za-z0-9_]*):)?([A-Za-z_][A-Za-z0-9_]*)>");

    private final String rule;
    private final List<Part> parts;
    private final Set<String> arguments;
    private final Pattern regex;

    private RoutePattern(String rule, List<Part> parts, Set<String> arguments, Pattern regex) {
        this.rule = rule;
        this.parts = parts;
        this.arguments = arguments;
        this.regex = regex;
    }

    /**
     * Parse a rule; rules start with {@code /} and name each placeholder once.
     */
    public static RoutePattern parse(String rule) {
        if (rule == null || !rule.startsWith("/")) {
            throw new IllegalArgumentException("rule must start with '/': " + rule);
        }
        List<Part> parts = new ArrayList<>();
        Set<String> arguments = new LinkedHashSet<>();
        StringBuilder regex = new StringBuilder("^");
        Matcher m = PLACEHOLDER.matcher(rule);
        int last = 0;
        while (m.find()) {
            String literal = rule.substring(last, m.start());
            addLiteral(rule, literal, parts, regex);
            String name = m.group(2);
            if (!arguments.add(name)) {
                throw new IllegalArgumentException("duplicate placeholder '" + name + "' in rule: " + rule);
            }
            PathConverter converter = PathConverter.forName(m.group(1));
            parts.add(new Part(null, name, converter));
            regex.append("(?<").append(groupName(arguments.size())).append('>')
                    .append(converter.regex()).append(')');
            last = m.end();
        }
        addLiteral(rule, rule.substring(last), parts, regex);
        regex.append('$');
        return new RoutePattern(
                rule,
                Collections.unmodifiableList(parts),
                Collections.unmodifiableSet(arguments),
                Pattern.compile(regex.toString())
        );
    }

    public String rule() {
        return rule;
    }

    /**
     * Placeholder names in rule order.
     */
    public Set<String> arguments() {
        return arguments;
    }

    /**
     * Substitute placeholder values; fails when a value is missing or rejected by its converter.
     */
    public String expand(Map<String, ?> values) {
        StringBuilder path = new StringBuilder();
        for (Part part : parts) {
            if (part.literal != null) {
                path.append(part.literal);
                continue;
            }
            Object value = values.get(part.name);
            if (value == null) {
                throw new IllegalArgumentException("missing value for '" + part.name + "'");
            }
            try {
                path.append(part.converter.toUrl(value));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("invalid value for '" + part.name + "': " + e.getMessage(), e);
            }
        }
        return path.toString();
    }

    /**
     * Match a request path, returning the raw placeholder values on success.
     */
    public Optional<Map<String, String>> match(String path) {
        if (path == null) {
            return Optional.empty();
        }
        Matcher m = regex.matcher(path);
        if (!m.matches()) {
            return Optional.empty();
        }
        Map<String, String> values = new LinkedHashMap<>();
        int index = 1;
        for (String name : arguments) {
            values.put(name, m.group(groupName(index++)));
        }
        return Optional.of(values);
    }

    @Override
    public String toString() {
        return rule;
    }

    private static void addLiteral(String rule, String literal, List<Part> parts, StringBuilder regex) {
        if (literal.isEmpty()) {
            return;
        }
        if (literal.indexOf('<') >= 0 || literal.indexOf('>') >= 0) {
            throw new IllegalArgumentException("malformed placeholder in rule: " + rule);
        }
        parts.add(new Part(literal, null, null));
        regex.append(Pattern.quote(literal));
    }

    // Rule names may not be valid regex group names, so groups are numbered.
    private static String groupName(int index) {
        return "a" + index;
    }

    private record Part(String literal, String name, PathConverter converter) {
    }
}
