package com.aigreentick.services.setupwizard.service.step;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Accumulates field errors for one validation pass, first error per field wins.
 * The check helpers produce the standard messages, e.g.
 * "Address is required", "Address must be at least 5 characters",
 * "Capacity must not exceed 999".
 */
class FieldErrors {

    static final Pattern EMAIL = Pattern.compile("^[A-Za-z0-9._%+'-]+@[A-Za-z0-9-]+(\\.[A-Za-z0-9-]+)*\\.[A-Za-z]{2,}$");

    private final Map<String, String> errors = new LinkedHashMap<>();

    void add(String field, String message) {
        errors.putIfAbsent(field, message);
    }

    Map<String, String> toMap() {
        return errors;
    }

    // ── Text ───────────────────────────────────────────────────────────

    /** @return true when present and within bounds */
    boolean requireText(String field, String value, String label, int min, int max) {
        if (value == null || value.isBlank()) {
            add(field, label + " is required");
            return false;
        }
        return checkLength(field, value, label, min, max);
    }

    /** Skipped when blank. */
    boolean optionalText(String field, String value, String label, int min, int max) {
        if (value == null || value.isBlank()) {
            return true;
        }
        return checkLength(field, value, label, min, max);
    }

    private boolean checkLength(String field, String value, String label, int min, int max) {
        int length = value.length();
        if (min > 0 && length < min) {
            add(field, label + " must be at least " + min + " characters");
            return false;
        }
        if (length > max) {
            add(field, label + " must not exceed " + max + " characters");
            return false;
        }
        return true;
    }

    // ── Numbers ────────────────────────────────────────────────────────

    /**
     * Check a present value is a number within [min, max].
     * Absence is the caller's concern.
     *
     * @param unit appended to the upper-bound message ("years"), or null
     */
    Optional<BigDecimal> number(String field, Object raw, String label,
                                BigDecimal min, BigDecimal max, String unit) {
        Optional<BigDecimal> number = PayloadReader.toNumber(raw);
        if (number.isEmpty()) {
            add(field, label + " must be a number");
            return Optional.empty();
        }
        BigDecimal value = number.get();
        if (value.compareTo(min) < 0) {
            add(field, min.signum() == 0
                    ? label + " must be 0 or greater"
                    : label + " must be at least " + min.toPlainString());
            return Optional.empty();
        }
        if (value.compareTo(max) > 0) {
            add(field, label + " must not exceed " + max.toPlainString() + (unit == null ? "" : " " + unit));
            return Optional.empty();
        }
        return number;
    }

    Optional<BigDecimal> number(String field, Object raw, String label, long min, long max) {
        return number(field, raw, label, BigDecimal.valueOf(min), BigDecimal.valueOf(max), null);
    }

    /** Skipped when absent. */
    Optional<BigDecimal> optionalNumber(String field, Object raw, String label, long min, long max) {
        if (PayloadReader.isAbsent(raw)) {
            return Optional.empty();
        }
        return number(field, raw, label, min, max);
    }

    // ── Formats ────────────────────────────────────────────────────────

    static boolean isEmail(String value) {
        return EMAIL.matcher(value).matches();
    }
}
