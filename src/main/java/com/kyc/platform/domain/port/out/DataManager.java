package com.kyc.platform.domain.port.out;

import com.kyc.platform.domain.model.Entity;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Performs the actual persistence for one entity type.
 * Criteria maps are equality matches joined with AND; a collection value matches any of its elements.
 */
public interface DataManager<T extends Entity> {

    Class<T> managedType();

    Optional<T> getById(long id);

    EntityQuery<T> getAll();

    EntityQuery<T> filterBy(Map<String, Object> criteria);

    /**
     * Build an entity from the given fields and store it.
     *
     * @return the stored entity, or empty when nothing was created
     */
    Optional<T> createInstance(Map<String, Object> fields);

    /**
     * Apply the fields to the entity in place and store the change.
     */
    T updateInstance(T entity, Map<String, Object> fields);

    void deleteInstance(T entity);

    List<T> bulkCreateInstances(List<T> entities, int batchSize);

    List<T> bulkUpdateInstances(List<T> entities, List<String> fieldNames, int batchSize);

    /**
     * @return the entities that were deleted
     */
    List<T> bulkDeleteInstances(Map<String, Object> criteria);

    long count();

    boolean exists(Map<String, Object> criteria);
}
