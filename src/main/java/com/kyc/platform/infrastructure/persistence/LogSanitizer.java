package com.kyc.platform.infrastructure.persistence;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Makes caller-supplied data safe to log: values under sensitive keys are
 * redacted and long strings are truncated, at any nesting depth.
 */
public final class LogSanitizer {

    static final String REDACTED = "[REDACTED]";
    static final String TRUNCATED = "...[TRUNCATED]";
    static final int MAX_STRING_LENGTH = 100;

    private static final Set<String> SENSITIVE_KEYS =
            Set.of("password", "token", "secret", "key", "api_key", "auth", "credential");

    private LogSanitizer() {
    }

    public static Object sanitize(Object data) {
        if (data instanceof Map<?, ?> map) {
            Map<Object, Object> sanitized = new LinkedHashMap<>();
            map.forEach((key, value) -> sanitized.put(key, isSensitive(key) ? REDACTED : sanitize(value)));
            return sanitized;
        }
        if (data instanceof Collection<?> collection) {
            List<Object> sanitized = new ArrayList<>(collection.size());
            for (Object item : collection) {
                sanitized.add(sanitize(item));
            }
            return sanitized;
        }
        if (data != null && data.getClass().isArray()) {
            int length = Array.getLength(data);
            List<Object> sanitized = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                sanitized.add(sanitize(Array.get(data, i)));
            }
            return sanitized;
        }
        if (data instanceof CharSequence text && text.length() > MAX_STRING_LENGTH) {
            return text.subSequence(0, MAX_STRING_LENGTH) + TRUNCATED;
        }
        return data;
    }

    private static boolean isSensitive(Object key) {
        if (key == null) {
            return false;
        }
        String lower = key.toString().toLowerCase(Locale.ROOT);
        return SENSITIVE_KEYS.stream().anyMatch(lower::contains);
    }
}
