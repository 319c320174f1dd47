package com.kyc.platform.infrastructure.persistence.jdbc;

import com.kyc.platform.domain.exception.EntityValidationException;
import com.kyc.platform.domain.model.BaseEntity;
import com.kyc.platform.domain.port.out.DataManager;
import com.kyc.platform.domain.port.out.EntityQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * PostgreSQL implementation of {@link DataManager} for one table.
 * <p>
 * Subclasses describe the table: its data columns, how a row maps to an entity
 * and how an entity maps back to column values. Column names double as the
 * entity's field names, so criteria and bulk-update field lists are checked
 * against them before any SQL is built.
 */
public abstract class JdbcDataManager<T extends BaseEntity> implements DataManager<T> {

    private static final Logger logger = LoggerFactory.getLogger(JdbcDataManager.class);

    protected static final String ID = "id";

    protected final NamedParameterJdbcTemplate jdbcTemplate;
    private final Class<T> type;
    private final String table;
    private final List<String> dataColumns;
    private final Set<String> queryableColumns;
    private final RowMapper<T> rowMapper = this::mapRow;

    protected JdbcDataManager(NamedParameterJdbcTemplate jdbcTemplate, Class<T> type, String table, List<String> dataColumns) {
        this.jdbcTemplate = jdbcTemplate;
        this.type = type;
        this.table = table;
        this.dataColumns = List.copyOf(dataColumns);
        this.queryableColumns = new LinkedHashSet<>();
        this.queryableColumns.add(ID);
        this.queryableColumns.addAll(dataColumns);
    }

    /**
     * Build a new, not yet stored entity from a field map.
     */
    protected abstract T newInstance(Map<String, Object> fields);

    protected abstract T mapRow(ResultSet rs, int rowNum) throws SQLException;

    /**
     * Column values for every data column, ready to bind.
     */
    protected abstract Map<String, Object> toColumns(T entity);

    @Override
    public Class<T> managedType() {
        return type;
    }

    @Override
    public Optional<T> getById(long id) {
        String sql = "SELECT * FROM " + table + " WHERE id = :id";
        return jdbcTemplate.query(sql, new MapSqlParameterSource(ID, id), rowMapper).stream().findFirst();
    }

    @Override
    public EntityQuery<T> getAll() {
        return new JdbcEntityQuery<>(jdbcTemplate, table, rowMapper, SqlCriteria.NONE);
    }

    @Override
    public EntityQuery<T> filterBy(Map<String, Object> criteria) {
        return new JdbcEntityQuery<>(jdbcTemplate, table, rowMapper, criteria(criteria));
    }

    @Override
    public Optional<T> createInstance(Map<String, Object> fields) {
        T entity = newInstance(fields);
        entity.prePersist();

        KeyHolder keyHolder = new GeneratedKeyHolder();
        int rows = jdbcTemplate.update(insertSql(), new MapSqlParameterSource(toColumns(entity)),
                keyHolder, new String[] {ID});
        if (rows == 0) {
            return Optional.empty();
        }
        entity.setId(generatedId(keyHolder.getKeys()));

        logger.debug("Inserted {} row with id {}", table, entity.getId());
        return Optional.of(entity);
    }

    @Override
    public T updateInstance(T entity, Map<String, Object> fields) {
        entity.applyFields(fields);
        int rows = jdbcTemplate.update(updateSql(dataColumns), parametersWithId(entity));
        if (rows == 0) {
            throw new EmptyResultDataAccessException(
                    String.format("%s row with id %d no longer exists", table, entity.getId()), 1);
        }
        return entity;
    }

    @Override
    public void deleteInstance(T entity) {
        int rows = jdbcTemplate.update("DELETE FROM " + table + " WHERE id = :id",
                new MapSqlParameterSource(ID, entity.getId()));
        logger.debug("Deleted {} {} row(s) for id {}", rows, table, entity.getId());
    }

    @Override
    public List<T> bulkCreateInstances(List<T> entities, int batchSize) {
        List<T> created = new ArrayList<>(entities.size());
        for (List<T> batch : partition(entities, batchSize)) {
            SqlParameterSource[] parameters = batch.stream()
                    .peek(BaseEntity::prePersist)
                    .map(entity -> new MapSqlParameterSource(toColumns(entity)))
                    .toArray(SqlParameterSource[]::new);

            KeyHolder keyHolder = new GeneratedKeyHolder();
            jdbcTemplate.batchUpdate(insertSql(), parameters, keyHolder, new String[] {ID});

            List<Map<String, Object>> keys = keyHolder.getKeyList();
            for (int i = 0; i < batch.size() && i < keys.size(); i++) {
                T entity = batch.get(i);
                entity.setId(generatedId(keys.get(i)));
                created.add(entity);
            }
        }
        logger.debug("Bulk inserted {} {} row(s) in batches of {}", created.size(), table, batchSize);
        return created;
    }

    @Override
    public List<T> bulkUpdateInstances(List<T> entities, List<String> fieldNames, int batchSize) {
        for (String field : fieldNames) {
            if (!dataColumns.contains(field)) {
                throw new EntityValidationException(
                        String.format("Field '%s' cannot be bulk updated on %s", field, type.getSimpleName()));
            }
        }
        for (int i = 0; i < entities.size(); i++) {
            if (entities.get(i).getId() == null) {
                throw new EntityValidationException(
                        "Instance at index " + i + " has no id and cannot be updated");
            }
        }

        String sql = updateSql(fieldNames);
        List<T> updated = new ArrayList<>(entities.size());
        for (List<T> batch : partition(entities, batchSize)) {
            SqlParameterSource[] parameters = batch.stream()
                    .map(this::parametersWithId)
                    .toArray(SqlParameterSource[]::new);

            int[] results = jdbcTemplate.batchUpdate(sql, parameters);
            for (int i = 0; i < results.length; i++) {
                if (results[i] > 0 || results[i] == Statement.SUCCESS_NO_INFO) {
                    updated.add(batch.get(i));
                }
            }
        }
        logger.debug("Bulk updated {} {} row(s) (fields: {})", updated.size(), table, fieldNames);
        return updated;
    }

    @Override
    public List<T> bulkDeleteInstances(Map<String, Object> criteria) {
        SqlCriteria where = criteria(criteria);
        List<T> deleted = new ArrayList<>(jdbcTemplate.query(
                "DELETE FROM " + table + where.clause() + " RETURNING *", where.parameterSource(), rowMapper));
        deleted.sort(Comparator.comparing(BaseEntity::getId));
        return deleted;
    }

    @Override
    public long count() {
        return getAll().count();
    }

    @Override
    public boolean exists(Map<String, Object> criteria) {
        SqlCriteria where = criteria(criteria);
        Boolean exists = jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM " + table + where.clause() + ")", where.parameterSource(), Boolean.class);
        return Boolean.TRUE.equals(exists);
    }

    protected static LocalDateTime toDateTime(Timestamp timestamp) {
        return timestamp != null ? timestamp.toLocalDateTime() : null;
    }

    protected static Timestamp toTimestamp(LocalDateTime dateTime) {
        return dateTime != null ? Timestamp.valueOf(dateTime) : null;
    }

    protected static Object code(Object value) {
        return SqlCriteria.toSqlValue(value);
    }

    private SqlCriteria criteria(Map<String, Object> criteria) {
        if (criteria != null) {
            for (String column : criteria.keySet()) {
                if (!queryableColumns.contains(column)) {
                    throw new EntityValidationException(
                            String.format("Unknown filter field '%s' for %s", column, type.getSimpleName()));
                }
            }
        }
        return SqlCriteria.of(criteria);
    }

    private MapSqlParameterSource parametersWithId(T entity) {
        Map<String, Object> values = new LinkedHashMap<>(toColumns(entity));
        values.put(ID, entity.getId());
        return new MapSqlParameterSource(values);
    }

    private String insertSql() {
        return "INSERT INTO " + table + " (" + String.join(", ", dataColumns) + ") VALUES ("
                + dataColumns.stream().map(column -> ":" + column).collect(Collectors.joining(", ")) + ")";
    }

    private String updateSql(List<String> columns) {
        return "UPDATE " + table + " SET "
                + columns.stream().map(column -> column + " = :" + column).collect(Collectors.joining(", "))
                + " WHERE id = :id";
    }

    private static long generatedId(Map<String, Object> keys) {
        Object id = keys != null ? keys.get(ID) : null;
        if (!(id instanceof Number number)) {
            throw new EmptyResultDataAccessException("No generated id returned", 1);
        }
        return number.longValue();
    }

    private static <E> List<List<E>> partition(List<E> items, int size) {
        List<List<E>> batches = new ArrayList<>();
        for (int start = 0; start < items.size(); start += size) {
            batches.add(items.subList(start, Math.min(start + size, items.size())));
        }
        return batches;
    }
}
