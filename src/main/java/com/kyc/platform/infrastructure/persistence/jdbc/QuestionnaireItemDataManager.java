package com.kyc.platform.infrastructure.persistence.jdbc;

import com.kyc.platform.domain.model.QuestionnaireItem;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class QuestionnaireItemDataManager extends JdbcDataManager<QuestionnaireItem> {

    private static final List<String> COLUMNS = List.of(
            "questionnaire_id", "question_id", "order_index", "created_at");

    public QuestionnaireItemDataManager(NamedParameterJdbcTemplate jdbcTemplate) {
        super(jdbcTemplate, QuestionnaireItem.class, "questionnaire_items", COLUMNS);
    }

    @Override
    protected QuestionnaireItem newInstance(Map<String, Object> fields) {
        return QuestionnaireItem.fromFields(fields);
    }

    @Override
    protected QuestionnaireItem mapRow(ResultSet rs, int rowNum) throws SQLException {
        QuestionnaireItem item = new QuestionnaireItem();
        item.setId(rs.getLong("id"));
        item.setQuestionnaireId(rs.getLong("questionnaire_id"));
        item.setQuestionId(rs.getLong("question_id"));
        item.setOrderIndex(rs.getInt("order_index"));
        item.setCreatedAt(toDateTime(rs.getTimestamp("created_at")));
        return item;
    }

    @Override
    protected Map<String, Object> toColumns(QuestionnaireItem item) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("questionnaire_id", item.getQuestionnaireId());
        columns.put("question_id", item.getQuestionId());
        columns.put("order_index", item.getOrderIndex());
        columns.put("created_at", toTimestamp(item.getCreatedAt()));
        return columns;
    }
}
