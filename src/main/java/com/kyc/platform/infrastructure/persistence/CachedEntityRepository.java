package com.kyc.platform.infrastructure.persistence;

import com.kyc.platform.domain.exception.EntityValidationException;
import com.kyc.platform.domain.exception.RepositoryConfigurationException;
import com.kyc.platform.domain.exception.RepositoryException;
import com.kyc.platform.domain.exception.RepositoryOperationException;
import com.kyc.platform.domain.model.BulkDeleteResult;
import com.kyc.platform.domain.model.Entity;
import com.kyc.platform.domain.model.EntityDescriptor;
import com.kyc.platform.domain.model.PageResult;
import com.kyc.platform.domain.port.out.CacheStore;
import com.kyc.platform.domain.port.out.DataManager;
import com.kyc.platform.domain.port.out.EntityRepository;
import com.kyc.platform.infrastructure.cache.AdvisoryCache;
import com.kyc.platform.infrastructure.cache.EntityCacheKeys;
import com.kyc.platform.infrastructure.cache.RepositoryCacheConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionOperations;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Supplier;

import static com.kyc.platform.infrastructure.persistence.EntityInputValidator.validateBatchSize;
import static com.kyc.platform.infrastructure.persistence.EntityInputValidator.validateFieldNames;
import static com.kyc.platform.infrastructure.persistence.EntityInputValidator.validateFields;
import static com.kyc.platform.infrastructure.persistence.EntityInputValidator.validateId;
import static com.kyc.platform.infrastructure.persistence.EntityInputValidator.validateInstances;
import static com.kyc.platform.infrastructure.persistence.LogSanitizer.sanitize;

/**
 * Caching implementation of {@link EntityRepository} for any entity type.
 * <p>
 * Inputs are validated before the {@link DataManager} is contacted. Reads go
 * through an advisory cache; every write runs in its own transaction and
 * invalidates the affected cache keys once the transaction has completed.
 * Anything logged from caller data passes through {@link LogSanitizer}.
 */
public class CachedEntityRepository<T extends Entity> implements EntityRepository<T> {

    private static final Logger logger = LoggerFactory.getLogger(CachedEntityRepository.class);

    static final String ID_FIELD = "id";
    static final int MAX_PER_PAGE = 1000;

    private final EntityDescriptor<T> descriptor;
    private final DataManagerRegistry managers;
    private final TransactionOperations transactions;
    private final RepositoryCacheConfig cacheConfig;
    private final AdvisoryCache cache;
    private final EntityCacheKeys keys;

    // Resolved on first use. Recomputing under a race yields the same manager.
    private volatile DataManager<T> manager;

    public CachedEntityRepository(EntityDescriptor<T> descriptor,
                                  DataManagerRegistry managers,
                                  CacheStore cacheStore,
                                  TransactionOperations transactions,
                                  RepositoryCacheConfig cacheConfig) {
        if (descriptor == null) {
            throw new RepositoryConfigurationException("Repository must have an entity descriptor defined");
        }
        this.descriptor = descriptor;
        this.managers = managers;
        this.transactions = transactions;
        this.cacheConfig = cacheConfig;
        this.cache = new AdvisoryCache(cacheStore, cacheConfig.isEnabled());
        this.keys = new EntityCacheKeys(descriptor, cacheConfig.getDefaultNamespace());
    }

    public EntityDescriptor<T> descriptor() {
        return descriptor;
    }

    public boolean isCacheEnabled() {
        return cache.isEnabled();
    }

    protected DataManager<T> manager() {
        DataManager<T> resolved = manager;
        if (resolved == null) {
            resolved = managers.find(descriptor.type())
                    .orElseThrow(() -> new RepositoryConfigurationException(
                            entityName() + " must have a valid DataManager"));
            manager = resolved;
        }
        return resolved;
    }

    @Override
    public Optional<T> getById(Object id) {
        long validId = validateId(id);
        String cacheKey = keys.entityKey(validId);

        try {
            Optional<T> cached = cache.get(cacheKey)
                    .filter(descriptor.type()::isInstance)
                    .map(descriptor.type()::cast);
            if (cached.isPresent()) {
                logger.debug("Cache hit for {} ID={}", entityName(), validId);
                return cached;
            }

            Optional<T> entity = manager().getById(validId);
            if (entity.isPresent()) {
                cache.set(cacheKey, entity.get(), cacheConfig.entityTimeout());
                logger.debug("Fetched {} ID={} from the datastore", entityName(), validId);
            } else {
                logger.debug("{} with ID={} not found", entityName(), validId);
            }
            return entity;

        } catch (RepositoryException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Failed to fetch {} by ID={}: {}", entityName(), sanitize(id), e.getMessage(), e);
            throw new RepositoryOperationException("Failed to fetch entity by ID: " + e.getMessage(), e);
        }
    }

    @Override
    public List<T> getAll(Integer limit, long offset) {
        if (limit != null && limit <= 0) {
            throw new EntityValidationException("Limit must be a positive integer, got " + limit);
        }
        if (offset < 0) {
            throw new EntityValidationException("Offset must be a non-negative integer, got " + offset);
        }
        String cacheKey = keys.rangeKey(limit, offset);

        try {
            Optional<List<T>> cached = cache.get(cacheKey).flatMap(this::asEntityList);
            if (cached.isPresent()) {
                logger.debug("Cache hit for {} collection (limit={}, offset={})", entityName(), limit, offset);
                return cached.get();
            }

            List<T> entities = fetchAll(limit, offset);
            cache.set(cacheKey, new ArrayList<>(entities), cacheConfig.collectionTimeout());
            return entities;

        } catch (RepositoryException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Failed to fetch {} instances: {}", entityName(), e.getMessage(), e);
            throw new RepositoryOperationException("Failed to fetch instances: " + e.getMessage(), e);
        }
    }

    @Override
    public Iterator<T> iterate(int batchSize) {
        return new BatchIterator(validateBatchSize(batchSize));
    }

    @Override
    public T create(Map<String, Object> fields) {
        Map<String, Object> validFields = validateFields(fields, "create");
        logger.debug("Creating {} with data: {}", entityName(), sanitize(validFields));

        try {
            T entity = inTransaction(() -> manager().createInstance(validFields)
                    .orElseThrow(() -> new RepositoryOperationException(
                            "Failed to create entity - manager returned no instance")));

            invalidateCollectionCaches();

            logger.info("Successfully created {} with ID={}", entityName(), entity.getId());
            return entity;

        } catch (RepositoryException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Unexpected error creating {} with data {}: {}",
                    entityName(), sanitize(fields), e.getMessage(), e);
            throw new RepositoryOperationException("Failed to create entity: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<T> update(Object id, Map<String, Object> fields) {
        long validId = validateId(id);
        Map<String, Object> validFields = validateFields(fields, "update");
        Object sanitizedData = sanitize(validFields);

        try {
            // Read from the datastore, never the cache, so the write starts from committed state
            Optional<T> updated = inTransaction(() -> manager().getById(validId)
                    .map(entity -> manager().updateInstance(entity, validFields)));

            if (updated.isEmpty()) {
                logger.warn("Update failed: {} with ID {} not found", entityName(), validId);
                return updated;
            }

            cache.delete(keys.entityKey(validId));
            invalidateCollectionCaches();

            logger.info("Successfully updated {} ID={} with data: {}", entityName(), validId, sanitizedData);
            return updated;

        } catch (RepositoryException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Failed to update {} ID={} with data {}: {}",
                    entityName(), sanitize(id), sanitize(fields), e.getMessage(), e);
            throw new RepositoryOperationException("Update failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<T> delete(Object id) {
        long validId = validateId(id);

        try {
            Optional<T> deleted = inTransaction(() -> manager().getById(validId)
                    .map(entity -> {
                        manager().deleteInstance(entity);
                        return entity;
                    }));

            if (deleted.isEmpty()) {
                logger.warn("Delete failed: {} with ID {} not found", entityName(), validId);
                return deleted;
            }

            cache.delete(keys.entityKey(validId));
            invalidateCollectionCaches();

            logger.info("Successfully deleted {} ID={}", entityName(), validId);
            return deleted;

        } catch (RepositoryException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Failed to delete {} ID={}: {}", entityName(), sanitize(id), e.getMessage(), e);
            throw new RepositoryOperationException("Deletion failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<T> bulkCreate(List<T> entities, int batchSize) {
        List<T> validEntities = validateInstances(entities, descriptor.type(), "bulk create");
        validateBatchSize(batchSize);
        logger.debug("Starting bulk create of {} {} instances", validEntities.size(), entityName());

        try {
            List<T> created = inTransaction(() -> {
                List<T> result = manager().bulkCreateInstances(validEntities, batchSize);
                if (result == null || result.isEmpty()) {
                    throw new RepositoryOperationException("Bulk create failed - no instances were created");
                }
                return result;
            });

            invalidateCollectionCaches();

            logger.info("Successfully created {}/{} {} instances", created.size(), validEntities.size(), entityName());
            return created;

        } catch (RepositoryException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Unexpected error during bulk create of {}: {}", entityName(), e.getMessage(), e);
            throw new RepositoryOperationException("Bulk create failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<T> bulkUpdate(List<T> entities, List<String> fields, int batchSize) {
        List<T> validEntities = validateInstances(entities, descriptor.type(), "bulk update");
        List<String> validFields = validateFieldNames(fields, "bulk update");
        validateBatchSize(batchSize);
        Object sanitizedFields = sanitize(validFields);
        logger.debug("Starting bulk update of {} {} instances (fields: {})",
                validEntities.size(), entityName(), sanitizedFields);

        try {
            List<T> updated = inTransaction(() -> {
                List<T> result = manager().bulkUpdateInstances(validEntities, validFields, batchSize);
                if (result == null || result.isEmpty()) {
                    throw new RepositoryOperationException("Bulk update failed - no instances were updated");
                }
                return result;
            });

            invalidateCollectionCaches();

            logger.info("Successfully updated {}/{} {} instances (fields: {})",
                    updated.size(), validEntities.size(), entityName(), sanitizedFields);
            return updated;

        } catch (RepositoryException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Unexpected error during bulk update of {} instances (fields: {}): {}",
                    entityName(), sanitizedFields, e.getMessage(), e);
            throw new RepositoryOperationException("Bulk update failed: " + e.getMessage(), e);
        }
    }

    @Override
    public BulkDeleteResult<T> bulkDelete(List<T> entities, Map<String, Object> filters) {
        List<T> validEntities = entities != null
                ? validateInstances(entities, descriptor.type(), "bulk delete")
                : null;
        Map<String, Object> criteria = filters != null ? new LinkedHashMap<>(filters) : new LinkedHashMap<>();

        if (validEntities == null && criteria.isEmpty()) {
            throw new EntityValidationException("Either instances list or filters must be provided for bulk delete");
        }
        if (validEntities != null) {
            if (criteria.containsKey(ID_FIELD)) {
                throw new EntityValidationException("Filter 'id' cannot be combined with an instances list");
            }
            criteria.put(ID_FIELD, idsOf(validEntities));
        }

        Object sanitizedFilters = sanitize(filters != null ? filters : Map.of());
        logger.debug("Starting bulk delete of {} instances (filters: {})", entityName(), sanitizedFilters);

        try {
            List<T> deleted = inTransaction(() -> manager().bulkDeleteInstances(criteria));

            invalidateCollectionCaches();

            logger.info("Successfully deleted {} {} instances (filters: {})",
                    deleted.size(), entityName(), sanitizedFilters);
            return BulkDeleteResult.of(deleted);

        } catch (RepositoryException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Unexpected error during bulk delete of {} instances (filters: {}): {}",
                    entityName(), sanitizedFilters, e.getMessage(), e);
            throw new RepositoryOperationException("Bulk delete failed: " + e.getMessage(), e);
        }
    }

    @Override
    public long count(Map<String, Object> filters) {
        Map<String, Object> criteria = filters != null ? filters : Map.of();
        String cacheKey = keys.countKey(criteria);

        try {
            Optional<Long> cached = cache.get(cacheKey)
                    .filter(Number.class::isInstance)
                    .map(value -> ((Number) value).longValue());
            if (cached.isPresent()) {
                logger.debug("Cache hit for {} count (filters: {})", entityName(), sanitize(criteria));
                return cached.get();
            }

            long count = criteria.isEmpty()
                    ? manager().count()
                    : manager().filterBy(criteria).count();

            cache.set(cacheKey, count, cacheConfig.countTimeout());

            logger.debug("Counted {} {} instances (filters: {})", count, entityName(), sanitize(criteria));
            return count;

        } catch (RepositoryException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Failed to count {} instances (filters: {}): {}",
                    entityName(), sanitize(criteria), e.getMessage(), e);
            throw new RepositoryOperationException("Count operation failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(Map<String, Object> filters) {
        if (filters == null || filters.isEmpty()) {
            throw new EntityValidationException("At least one filter must be provided for existence check");
        }

        try {
            boolean exists = manager().exists(filters);
            logger.debug("Existence check for {} (filters: {}): {}", entityName(), sanitize(filters), exists);
            return exists;

        } catch (RepositoryException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Failed existence check for {} (filters: {}): {}",
                    entityName(), sanitize(filters), e.getMessage(), e);
            throw new RepositoryOperationException("Existence check failed: " + e.getMessage(), e);
        }
    }

    @Override
    public PageResult<T> paginate(int page, int perPage, Map<String, Object> filters) {
        if (page < 1) {
            throw new EntityValidationException("Page must be a positive integer, got " + page);
        }
        if (perPage < 1) {
            throw new EntityValidationException("Per-page count must be a positive integer, got " + perPage);
        }
        if (perPage > MAX_PER_PAGE) {
            throw new EntityValidationException(String.format(
                    "Per-page count too large, maximum is %d, got %d", MAX_PER_PAGE, perPage));
        }
        Map<String, Object> criteria = filters != null ? filters : Map.of();

        try {
            long totalCount = count(criteria);
            long offset = (long) (page - 1) * perPage;

            List<T> entities = criteria.isEmpty()
                    ? fetchAll(perPage, offset)
                    : manager().filterBy(criteria).slice(offset, perPage);

            PageResult<T> result = PageResult.of(entities, totalCount, page, perPage);
            logger.debug("Retrieved page {} of {} entities (per_page={}, total={}, filters: {})",
                    page, entityName(), perPage, totalCount, sanitize(criteria));
            return result;

        } catch (RepositoryException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Failed to get paginated {} entities (page={}, per_page={}, filters: {}): {}",
                    entityName(), page, perPage, sanitize(criteria), e.getMessage(), e);
            throw new RepositoryOperationException("Pagination failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void clearCache(Object id) {
        Long validId = id != null ? validateId(id) : null;

        try {
            if (validId != null) {
                cache.delete(keys.entityKey(validId));
                logger.debug("Cleared cache for {} ID={}", entityName(), validId);
            } else {
                invalidateCollectionCaches();
                logger.debug("Cleared collection caches for {}", entityName());
            }
        } catch (RuntimeException e) {
            // Cache clearing never fails the caller
            logger.error("Failed to clear cache for {}: {}", entityName(), e.getMessage(), e);
        }
    }

    /**
     * Run a read against the manager with the repository's error policy:
     * repository errors pass through, anything else is logged and normalized.
     */
    protected <R> R read(String operation, Object context, Supplier<R> query) {
        try {
            return query.get();
        } catch (RepositoryException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Failed to {} {} ({}): {}", operation, entityName(), sanitize(context), e.getMessage(), e);
            throw new RepositoryOperationException("Failed to " + operation + ": " + e.getMessage(), e);
        }
    }

    protected String entityName() {
        return descriptor.typeName();
    }

    private List<T> fetchAll(Integer limit, long offset) {
        List<T> entities = manager().getAll().slice(offset, limit);
        logger.debug("Fetched {} {} instances (limit={}, offset={})", entities.size(), entityName(), limit, offset);
        return entities;
    }

    private void invalidateCollectionCaches() {
        if (!cache.isEnabled()) {
            return;
        }
        for (String family : keys.collectionFamilies()) {
            cache.evictFamily(family);
        }
    }

    private <R> R inTransaction(Supplier<R> work) {
        return transactions.execute(status -> work.get());
    }

    private Optional<List<T>> asEntityList(Object cached) {
        if (!(cached instanceof List<?> list)) {
            return Optional.empty();
        }
        List<T> entities = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!descriptor.type().isInstance(item)) {
                return Optional.empty();
            }
            entities.add(descriptor.type().cast(item));
        }
        return Optional.of(entities);
    }

    private static List<Long> idsOf(List<? extends Entity> entities) {
        List<Long> ids = new ArrayList<>(entities.size());
        for (int i = 0; i < entities.size(); i++) {
            Long id = entities.get(i).getId();
            if (id == null) {
                throw new EntityValidationException("Instance at index " + i + " has no id and cannot be deleted");
            }
            ids.add(id);
        }
        return ids;
    }

    /**
     * Walks the collection with offset paging; stops after the first short batch.
     */
    private final class BatchIterator implements Iterator<T> {

        private final int batchSize;
        private Iterator<T> current = Collections.emptyIterator();
        private long offset;
        private boolean exhausted;

        private BatchIterator(int batchSize) {
            this.batchSize = batchSize;
        }

        @Override
        public boolean hasNext() {
            while (!current.hasNext()) {
                if (exhausted) {
                    return false;
                }
                List<T> batch = fetchBatch();
                exhausted = batch.size() < batchSize;
                offset += batchSize;
                current = batch.iterator();
            }
            return true;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }

        private List<T> fetchBatch() {
            try {
                return fetchAll(batchSize, offset);
            } catch (RepositoryException e) {
                throw e;
            } catch (RuntimeException e) {
                logger.error("Error in entities iterator for {}: {}", entityName(), e.getMessage(), e);
                throw new RepositoryOperationException("Iterator failed: " + e.getMessage(), e);
            }
        }
    }
}
