package com.kyc.platform.domain.model;

import com.kyc.platform.domain.exception.EntityValidationException;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;

/**
 * Common identity and audit fields for stored records, plus the coercion
 * helpers subclasses use when applying field maps.
 */
public abstract class BaseEntity implements Entity {

    private Long id;
    private LocalDateTime createdAt;

    @Override
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    /**
     * Stamps the creation time if the record does not carry one yet.
     */
    public void prePersist() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    @Override
    public void applyFields(Map<String, Object> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        fields.forEach((field, value) -> {
            if ("created_at".equals(field)) {
                this.createdAt = asDateTime(field, value);
            } else if (!applyField(field, value)) {
                throw new EntityValidationException(
                        String.format("Unknown field '%s' for %s", field, getClass().getSimpleName()));
            }
        });
    }

    /**
     * Apply a single field.
     *
     * @return false when the field is not known to this entity
     */
    protected abstract boolean applyField(String field, Object value);

    protected static String asString(String field, Object value, int maxLength) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof CharSequence)) {
            throw invalid(field, "must be a string", value);
        }
        String text = value.toString();
        if (text.length() > maxLength) {
            throw new EntityValidationException(
                    String.format("Field '%s' must be at most %d characters, got %d", field, maxLength, text.length()));
        }
        return text;
    }

    protected static Long asLong(String field, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short) {
            return ((Number) value).longValue();
        }
        if (value instanceof String text && !text.isBlank() && text.chars().allMatch(Character::isDigit)) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw invalid(field, "is out of range", value);
            }
        }
        throw invalid(field, "must be an integer", value);
    }

    protected static Integer asNonNegativeInteger(String field, Object value) {
        Long number = asLong(field, value);
        if (number == null) {
            return null;
        }
        if (number < 0 || number > Integer.MAX_VALUE) {
            throw invalid(field, "must be a non-negative integer", value);
        }
        return number.intValue();
    }

    protected static LocalDateTime asDateTime(String field, Object value) {
        if (value == null || value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof String text) {
            try {
                return LocalDateTime.parse(text);
            } catch (DateTimeParseException e) {
                throw invalid(field, "must be an ISO date-time", value);
            }
        }
        throw invalid(field, "must be a date-time", value);
    }

    protected static <E extends Enum<E> & CodedValue> E asCoded(String field, Object value, Class<E> type) {
        if (value == null) {
            return null;
        }
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        if (value instanceof String code) {
            return CodedValue.fromCode(type, code);
        }
        throw invalid(field, "must be a " + type.getSimpleName(), value);
    }

    protected static void requirePresent(String field, Object value) {
        if (value == null) {
            throw new EntityValidationException(String.format("Field '%s' is required", field));
        }
    }

    private static EntityValidationException invalid(String field, String problem, Object value) {
        return new EntityValidationException(
                String.format("Field '%s' %s, got %s", field, problem, value.getClass().getSimpleName()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BaseEntity other = (BaseEntity) o;
        return id != null && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        // Ids are assigned on insert, so the hash must not depend on them
        return getClass().hashCode();
    }
}
