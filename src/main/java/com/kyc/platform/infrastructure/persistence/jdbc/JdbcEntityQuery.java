package com.kyc.platform.infrastructure.persistence.jdbc;

import com.kyc.platform.domain.port.out.EntityQuery;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Deferred SELECT over one table. Each terminal call issues its own statement.
 */
final class JdbcEntityQuery<T> implements EntityQuery<T> {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final String table;
    private final RowMapper<T> rowMapper;
    private final SqlCriteria criteria;

    JdbcEntityQuery(NamedParameterJdbcTemplate jdbcTemplate, String table, RowMapper<T> rowMapper, SqlCriteria criteria) {
        this.jdbcTemplate = jdbcTemplate;
        this.table = table;
        this.rowMapper = rowMapper;
        this.criteria = criteria;
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + table + criteria.clause(), criteria.parameterSource(), Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public Optional<T> first() {
        return slice(0, 1).stream().findFirst();
    }

    @Override
    public List<T> slice(long offset, Integer limit) {
        StringBuilder sql = new StringBuilder("SELECT * FROM ")
                .append(table)
                .append(criteria.clause())
                .append(" ORDER BY id");

        MapSqlParameterSource parameters = criteria.parameterSource();
        if (limit != null) {
            sql.append(" LIMIT :limit_");
            parameters.addValue("limit_", limit);
        }
        if (offset > 0) {
            sql.append(" OFFSET :offset_");
            parameters.addValue("offset_", offset);
        }
        return jdbcTemplate.query(sql.toString(), parameters, rowMapper);
    }
}
