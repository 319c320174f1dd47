package com.kyc.platform.infrastructure.persistence.jdbc;

import com.kyc.platform.domain.model.CodedValue;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * A WHERE clause built from an equality criteria map, with its named parameters.
 * A {@code null} value matches NULL, a collection matches any of its elements.
 */
record SqlCriteria(String clause, Map<String, Object> parameters) {

    static final SqlCriteria NONE = new SqlCriteria("", Map.of());

    static SqlCriteria of(Map<String, ?> criteria) {
        if (criteria == null || criteria.isEmpty()) {
            return NONE;
        }
        List<String> conditions = new ArrayList<>();
        MapSqlParameterSource parameters = new MapSqlParameterSource();
        int index = 0;
        for (Map.Entry<String, ?> entry : criteria.entrySet()) {
            String column = entry.getKey();
            Object value = entry.getValue();
            String parameter = "c" + index++;

            if (value == null) {
                conditions.add(column + " IS NULL");
            } else if (value instanceof Collection<?> values) {
                if (values.isEmpty()) {
                    conditions.add("1 = 0");
                } else {
                    conditions.add(column + " IN (:" + parameter + ")");
                    parameters.addValue(parameter, values.stream().map(SqlCriteria::toSqlValue).toList());
                }
            } else {
                conditions.add(column + " = :" + parameter);
                parameters.addValue(parameter, toSqlValue(value));
            }
        }
        return new SqlCriteria(" WHERE " + String.join(" AND ", conditions), parameters.getValues());
    }

    MapSqlParameterSource parameterSource() {
        return new MapSqlParameterSource(parameters);
    }

    static Object toSqlValue(Object value) {
        return value instanceof CodedValue coded ? coded.code() : value;
    }
}
