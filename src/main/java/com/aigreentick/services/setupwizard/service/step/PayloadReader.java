package com.aigreentick.services.setupwizard.service.step;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lenient readers for decoded JSON payloads.
 * Numbers may arrive as JSON numbers or numeric strings; booleans as
 * JSON booleans, "Y"/"N", "true"/"false" or 1/0.
 */
public final class PayloadReader {

    private PayloadReader() {
    }

    /** Trimmed text, "" when absent. */
    public static String text(Map<String, ?> payload, String key) {
        Object value = payload == null ? null : payload.get(key);
        return value == null ? "" : value.toString().trim();
    }

    /** Trimmed text, null when absent or blank. */
    public static String textOrNull(Map<String, ?> payload, String key) {
        String value = text(payload, key);
        return value.isEmpty() ? null : value;
    }

    public static boolean isAbsent(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }

    public static Optional<BigDecimal> toNumber(Object value) {
        if (value instanceof Number number) {
            return Optional.of(new BigDecimal(number.toString()));
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Optional.of(new BigDecimal(s.trim()));
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public static Optional<Integer> toInteger(Object value) {
        return toNumber(value).map(BigDecimal::intValue);
    }

    public static boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.intValue() != 0;
        }
        if (value instanceof String s) {
            String v = s.trim();
            return v.equalsIgnoreCase("Y") || v.equalsIgnoreCase("true")
                    || v.equals("1") || v.equalsIgnoreCase("on") || v.equalsIgnoreCase("yes");
        }
        return false;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> object(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        return new LinkedHashMap<>();
    }

    /**
     * Elements of a JSON array as objects. Non-object elements become empty
     * maps so per-index validation still reports them.
     */
    public static List<Map<String, Object>> records(Object value) {
        List<Map<String, Object>> records = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
                records.add(object(element));
            }
        }
        return records;
    }

    public static List<String> strings(Object value) {
        List<String> strings = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (element != null) {
                    strings.add(element.toString().trim());
                }
            }
        } else if (value instanceof String s && !s.isBlank()) {
            for (String part : s.split(",")) {
                strings.add(part.trim());
            }
        }
        return strings;
    }
}
