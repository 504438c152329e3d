package io.toolfence.core.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the argument list of a {@code [name(key="value", other=42)]} call literal. Values are
 * kept as strings.
 */
final class CallLiteralArguments {

    private CallLiteralArguments() {
    }

    static Map<String, String> parse(String raw) {
        Map<String, String> args = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) {
            return args;
        }
        for (String pair : splitTopLevel(raw)) {
            String trimmed = pair.trim();
            int equals = trimmed.indexOf('=');
            if (equals <= 0) {
                continue;
            }
            String key = trimmed.substring(0, equals).trim();
            String value = trimmed.substring(equals + 1).trim();
            args.put(key, stripQuotes(value));
        }
        return args;
    }

    static List<String> splitTopLevel(String raw) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        int depth = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (quote != 0) {
                if (c == quote && raw.charAt(i - 1) != '\\') {
                    quote = 0;
                }
                current.append(c);
                continue;
            }
            switch (c) {
                case '"', '\'' -> quote = c;
                case '[', '{' -> depth++;
                case ']', '}' -> depth = Math.max(0, depth - 1);
                default -> {
                }
            }
            if (c == ',' && depth == 0) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString());
        return parts;
    }

    private static String stripQuotes(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
