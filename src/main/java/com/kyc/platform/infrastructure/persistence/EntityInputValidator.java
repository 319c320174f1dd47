package com.kyc.platform.infrastructure.persistence;

import com.kyc.platform.domain.exception.EntityValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input checks shared by every repository operation.
 * All failures raise {@link EntityValidationException} with a descriptive message.
 */
public final class EntityInputValidator {

    private EntityInputValidator() {
    }

    /**
     * Accepts an integral number or a string of digits.
     *
     * @return the id as a positive long
     */
    public static long validateId(Object id) {
        if (id == null) {
            throw new EntityValidationException("ID cannot be null");
        }

        long value;
        if (id instanceof String text) {
            if (text.isBlank()) {
                throw new EntityValidationException("ID cannot be empty string");
            }
            if (!text.chars().allMatch(c -> c >= '0' && c <= '9')) {
                throw new EntityValidationException(
                        String.format("Invalid ID format: '%s' must be a positive integer", text));
            }
            try {
                value = Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw new EntityValidationException(
                        String.format("Invalid ID format: '%s' must be a positive integer", text));
            }
        } else if (id instanceof Long || id instanceof Integer || id instanceof Short || id instanceof Byte) {
            value = ((Number) id).longValue();
        } else {
            throw new EntityValidationException("ID must be an integer, got " + id.getClass().getSimpleName());
        }

        if (value <= 0) {
            throw new EntityValidationException("ID must be positive, got " + value);
        }
        return value;
    }

    /**
     * Drops entries whose value is null or the empty string.
     *
     * @return the cleaned copy, never empty
     */
    public static Map<String, Object> validateFields(Map<String, ?> fields, String operation) {
        if (fields == null || fields.isEmpty()) {
            throw new EntityValidationException("No data provided for " + operation);
        }

        Map<String, Object> cleaned = new LinkedHashMap<>();
        fields.forEach((field, value) -> {
            if (value != null && !"".equals(value)) {
                cleaned.put(field, value);
            }
        });

        if (cleaned.isEmpty()) {
            throw new EntityValidationException("No valid data provided for " + operation + " after cleaning");
        }
        return cleaned;
    }

    public static <T> List<T> validateInstances(List<?> instances, Class<T> type, String operation) {
        if (instances == null) {
            throw new EntityValidationException("Instances must be a list for " + operation);
        }
        if (instances.isEmpty()) {
            throw new EntityValidationException("Empty instances list provided for " + operation);
        }

        List<T> validated = new ArrayList<>(instances.size());
        for (int i = 0; i < instances.size(); i++) {
            Object instance = instances.get(i);
            if (!type.isInstance(instance)) {
                throw new EntityValidationException(String.format(
                        "Instance at index %d is not a %s instance, got %s", i, type.getSimpleName(),
                        instance == null ? "null" : instance.getClass().getSimpleName()));
            }
            validated.add(type.cast(instance));
        }
        return validated;
    }

    /**
     * @return the field names, trimmed
     */
    public static List<String> validateFieldNames(List<?> fields, String operation) {
        if (fields == null) {
            throw new EntityValidationException("Fields must be a list for " + operation);
        }
        if (fields.isEmpty()) {
            throw new EntityValidationException("Empty fields list provided for " + operation);
        }

        List<String> names = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            Object field = fields.get(i);
            if (!(field instanceof String name) || name.isBlank()) {
                throw new EntityValidationException(String.format(
                        "Field at index %d must be a non-empty string, got %s", i,
                        field == null ? "null" : field.getClass().getSimpleName()));
            }
            names.add(name.trim());
        }
        return names;
    }

    public static int validateBatchSize(int batchSize) {
        if (batchSize <= 0) {
            throw new EntityValidationException("Batch size must be a positive integer, got " + batchSize);
        }
        return batchSize;
    }
}
