package com.example.indexingtelemetry.ingest;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lenient readers for event payloads. Values written by other processes or older
 * versions may arrive as strings, numbers or booleans; malformed values fall back to defaults.
 */
public final class Payloads {

    private Payloads() {
    }

    public static boolean getBoolean(Map<String, Object> payload, String key, boolean defaultValue) {
        Object value = payload == null ? null : payload.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue() != 0;
        }
        if (value instanceof String) {
            String s = ((String) value).trim().toLowerCase(Locale.ROOT);
            if (s.equals("true") || s.equals("1") || s.equals("yes")) {
                return true;
            }
            if (s.equals("false") || s.equals("0") || s.equals("no") || s.isEmpty()) {
                return false;
            }
        }
        return defaultValue;
    }

    public static long getLong(Map<String, Object> payload, String key, long defaultValue) {
        Object value = payload == null ? null : payload.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public static String getString(Map<String, Object> payload, String key, String defaultValue) {
        Object value = payload == null ? null : payload.get(key);
        if (value == null) {
            return defaultValue;
        }
        String s = value.toString();
        return s.isBlank() ? defaultValue : s;
    }

    /** Reads a list of item ids; entries that are not numeric are skipped. */
    public static List<Long> getLongList(Map<String, Object> payload, String key) {
        Object value = payload == null ? null : payload.get(key);
        List<Long> result = new ArrayList<>();
        if (!(value instanceof Collection)) {
            return result;
        }
        for (Object o : (Collection<?>) value) {
            if (o instanceof Number) {
                result.add(((Number) o).longValue());
            } else if (o != null) {
                try {
                    result.add(Long.parseLong(o.toString().trim()));
                } catch (NumberFormatException ignored) {
                    // non-numeric ids such as "unknown"
                }
            }
        }
        return result;
    }
}
