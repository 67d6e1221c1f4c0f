// File: CliArgsParser.java
package org.security.qkd;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/** Turns {@code key=value} command-line arguments into a map, splitting on the first '='. */
public final class CliArgsParser {
    private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

    private CliArgsParser() {}

    public static Map<String, String> toMap(String[] args) {
        Map<String, String> map = new LinkedHashMap<>();
        if (args == null) return map;
        for (String raw : args) {
            if (raw == null) continue;
            if (raw.isBlank()) continue;
            // values are kept verbatim; only the key is trimmed
            int idx = raw.indexOf('=');
            String key = idx < 0 ? "" : raw.substring(0, idx).trim();
            if (key.isEmpty() || idx == raw.length() - 1) {
                throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
            }
            String value = raw.substring(idx + 1);
            if (!KEY_PATTERN.matcher(key).matches()) throw new IllegalArgumentException("invalid argument name: " + key);
            if (containsControl(value)) {
                throw new IllegalArgumentException("argument " + key + " must not contain control characters");
            }
            if (map.put(key, value) != null) throw new IllegalArgumentException("duplicate argument: " + key);
        }
        return map;
    }

    private static boolean containsControl(CharSequence value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isISOControl(value.charAt(i))) return true;
        }
        return false;
    }
}
