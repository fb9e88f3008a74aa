package com.aigreentick.services.setupwizard.service.step;

import java.util.Map;

/**
 * Overlay of form data layers. Objects merge key by key, recursively;
 * any other value, arrays included, replaces the underlying one.
 */
public final class PayloadMerger {

    private PayloadMerger() {
    }

    /**
     * Merge {@code overlay} into {@code target} in place.
     *
     * @return {@code target}
     */
    public static Map<String, Object> overlay(Map<String, Object> target, Map<String, ?> overlay) {
        if (overlay == null) {
            return target;
        }
        overlay.forEach((key, value) -> {
            Object existing = target.get(key);
            if (existing instanceof Map<?, ?> && value instanceof Map<?, ?>) {
                Map<String, Object> merged = PayloadReader.object(existing);
                overlay(merged, PayloadReader.object(value));
                target.put(key, merged);
            } else {
                target.put(key, value);
            }
        });
        return target;
    }
}
