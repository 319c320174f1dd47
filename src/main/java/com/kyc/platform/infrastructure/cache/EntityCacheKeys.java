package com.kyc.platform.infrastructure.cache;

import com.kyc.platform.domain.model.CodedValue;
import com.kyc.platform.domain.model.EntityDescriptor;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Derives cache keys for one entity type.
 * Keys are a pure function of the descriptor and the id or suffix, e.g.
 * {@code questionnaire.questionnaire.42} or {@code questionnaire.questionnaire.count_all}.
 */
public final class EntityCacheKeys {

    public static final String ALL = "all";
    public static final String COUNT = "count";
    public static final String PAGINATED = "paginated";

    private static final String RESERVED = "%=&(),~";
    private static final String NULL_ELEMENT = "~";

    private final String prefix;

    public EntityCacheKeys(EntityDescriptor<?> descriptor, String fallbackNamespace) {
        this.prefix = descriptor.namespace(fallbackNamespace) + "." + descriptor.name();
    }

    public String entityKey(long id) {
        return prefix + "." + id;
    }

    public String entityKey(long id, String suffix) {
        if (suffix == null || suffix.isEmpty()) {
            return entityKey(id);
        }
        return entityKey(id) + "." + suffix;
    }

    public String collectionKey() {
        return collectionKey(ALL);
    }

    public String collectionKey(String suffix) {
        return prefix + "." + suffix;
    }

    /**
     * Key for a range of the unfiltered collection. The full, unranged collection uses plain {@code all}.
     */
    public String rangeKey(Integer limit, long offset) {
        if (limit == null && offset == 0) {
            return collectionKey(ALL);
        }
        return collectionKey(String.format("%s.limit_%s.offset_%d", ALL, limit == null ? "none" : limit, offset));
    }

    /**
     * Filters are sorted by name so equal filter maps always share a key.
     * Entries render as {@code name=value} joined by {@code &}; a null match is
     * {@code name=~} and a collection is {@code name=(a,b)}. Reserved characters inside
     * names and values are percent-encoded, so distinct filter maps never share a key.
     */
    public String countKey(Map<String, ?> filters) {
        if (filters == null || filters.isEmpty()) {
            return collectionKey(COUNT + "_" + ALL);
        }
        String criteria = new TreeMap<>(filters).entrySet().stream()
                .map(entry -> renderEntry(entry.getKey(), entry.getValue()))
                .collect(Collectors.joining("&"));
        return collectionKey(COUNT + "_" + criteria);
    }

    public List<String> collectionFamilies() {
        return List.of(collectionKey(ALL), collectionKey(COUNT), collectionKey(PAGINATED));
    }

    private static String renderEntry(String name, Object value) {
        if (value instanceof Collection<?> values) {
            return escape(name) + "=(" + values.stream()
                    .map(EntityCacheKeys::renderValue)
                    .collect(Collectors.joining(",")) + ")";
        }
        return escape(name) + "=" + renderValue(value);
    }

    private static String renderValue(Object value) {
        if (value == null) {
            return NULL_ELEMENT;
        }
        if (value instanceof CodedValue coded) {
            return escape(coded.code());
        }
        return escape(String.valueOf(value));
    }

    private static String escape(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (RESERVED.indexOf(c) >= 0) {
                escaped.append('%').append(String.format("%02X", (int) c));
            } else {
                escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
