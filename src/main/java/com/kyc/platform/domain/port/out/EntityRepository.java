package com.kyc.platform.domain.port.out;

import com.kyc.platform.domain.model.BulkDeleteResult;
import com.kyc.platform.domain.model.Entity;
import com.kyc.platform.domain.model.PageResult;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository port for any entity type.
 * Implementation details (validation, caching, transactions) are hidden from callers.
 * <p>
 * Invalid input raises {@link com.kyc.platform.domain.exception.EntityValidationException};
 * any other failure raises {@link com.kyc.platform.domain.exception.RepositoryOperationException}.
 */
public interface EntityRepository<T extends Entity> {

    int DEFAULT_BATCH_SIZE = 100;

    /**
     * @param id positive integer or numeric string
     */
    Optional<T> getById(Object id);

    default List<T> getAll() {
        return getAll(null, 0);
    }

    List<T> getAll(Integer limit, long offset);

    /**
     * Forward-only, non-restartable walk over every entity, fetched in batches.
     */
    Iterator<T> iterate(int batchSize);

    T create(Map<String, Object> fields);

    /**
     * @return the updated entity, or empty when no entity has that id
     */
    Optional<T> update(Object id, Map<String, Object> fields);

    /**
     * @return the deleted entity, or empty when no entity has that id
     */
    Optional<T> delete(Object id);

    List<T> bulkCreate(List<T> entities, int batchSize);

    List<T> bulkUpdate(List<T> entities, List<String> fields, int batchSize);

    /**
     * Delete the given entities, or everything matching the filters, or the given entities
     * that also match the filters. At least one of the two must be supplied.
     */
    BulkDeleteResult<T> bulkDelete(List<T> entities, Map<String, Object> filters);

    long count(Map<String, Object> filters);

    default long count() {
        return count(Map.of());
    }

    boolean exists(Map<String, Object> filters);

    PageResult<T> paginate(int page, int perPage, Map<String, Object> filters);

    void clearCache(Object id);

    default void clearCache() {
        clearCache(null);
    }
}
