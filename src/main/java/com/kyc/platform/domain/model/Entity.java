package com.kyc.platform.domain.model;

import java.util.Map;

/**
 * Contract every persisted record handled by a repository must satisfy.
 * Field maps are keyed by the snake_case field names of the stored record.
 */
public interface Entity {

    Long getId();

    /**
     * Apply the given field values to this instance in place.
     *
     * @throws com.kyc.platform.domain.exception.EntityValidationException on unknown fields or bad values
     */
    void applyFields(Map<String, Object> fields);
}
