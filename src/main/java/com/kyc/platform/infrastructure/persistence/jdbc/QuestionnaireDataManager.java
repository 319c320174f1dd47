package com.kyc.platform.infrastructure.persistence.jdbc;

import com.kyc.platform.domain.model.CodedValue;
import com.kyc.platform.domain.model.Questionnaire;
import com.kyc.platform.domain.model.QuestionnaireScope;
import com.kyc.platform.domain.model.QuestionnaireType;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class QuestionnaireDataManager extends JdbcDataManager<Questionnaire> {

    private static final List<String> COLUMNS = List.of(
            "name", "about", "questionnaire_type", "questionnaire_scope", "staff_id", "created_at");

    public QuestionnaireDataManager(NamedParameterJdbcTemplate jdbcTemplate) {
        super(jdbcTemplate, Questionnaire.class, "questionnaires", COLUMNS);
    }

    @Override
    protected Questionnaire newInstance(Map<String, Object> fields) {
        return Questionnaire.fromFields(fields);
    }

    @Override
    protected Questionnaire mapRow(ResultSet rs, int rowNum) throws SQLException {
        Questionnaire questionnaire = new Questionnaire();
        questionnaire.setId(rs.getLong("id"));
        questionnaire.setName(rs.getString("name"));
        questionnaire.setAbout(rs.getString("about"));
        questionnaire.setQuestionnaireType(CodedValue.fromCode(QuestionnaireType.class, rs.getString("questionnaire_type")));
        questionnaire.setQuestionnaireScope(CodedValue.fromCode(QuestionnaireScope.class, rs.getString("questionnaire_scope")));
        questionnaire.setStaffId(rs.getObject("staff_id", Long.class));
        questionnaire.setCreatedAt(toDateTime(rs.getTimestamp("created_at")));
        return questionnaire;
    }

    @Override
    protected Map<String, Object> toColumns(Questionnaire questionnaire) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("name", questionnaire.getName());
        columns.put("about", questionnaire.getAbout());
        columns.put("questionnaire_type", code(questionnaire.getQuestionnaireType()));
        columns.put("questionnaire_scope", code(questionnaire.getQuestionnaireScope()));
        columns.put("staff_id", questionnaire.getStaffId());
        columns.put("created_at", toTimestamp(questionnaire.getCreatedAt()));
        return columns;
    }
}
