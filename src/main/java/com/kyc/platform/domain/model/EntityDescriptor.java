package com.kyc.platform.domain.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Describes an entity type to the repository layer: its class, logical name
 * and the namespace (logical grouping) its cache keys live under.
 *
 * @param type  entity class
 * @param name  logical entity name, lower case
 * @param group declared grouping, {@code null} when undeclared
 */
public record EntityDescriptor<T extends Entity>(Class<T> type, String name, String group) {

    public EntityDescriptor {
        Objects.requireNonNull(type, "type must not be null");
        name = name == null || name.isBlank()
                ? type.getSimpleName().toLowerCase(Locale.ROOT)
                : name.toLowerCase(Locale.ROOT);
        group = group == null || group.isBlank() ? null : group;
    }

    public static <T extends Entity> EntityDescriptor<T> of(Class<T> type, String group) {
        return new EntityDescriptor<>(type, null, group);
    }

    public String namespace(String fallback) {
        return group != null ? group : fallback;
    }

    public String typeName() {
        return type.getSimpleName();
    }
}
