package com.kyc.platform.infrastructure.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kyc.platform.domain.model.CodedValue;
import com.kyc.platform.domain.model.Question;
import com.kyc.platform.domain.model.QuestionType;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Questions keep their validation rules as a JSON document in a text column.
 */
@Component
public class QuestionDataManager extends JdbcDataManager<Question> {

    private static final List<String> COLUMNS = List.of(
            "question_type", "reference_code", "text", "validation_rules", "staff_id", "created_at");

    private static final TypeReference<LinkedHashMap<String, Object>> RULES_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public QuestionDataManager(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        super(jdbcTemplate, Question.class, "questions", COLUMNS);
        this.objectMapper = objectMapper;
    }

    @Override
    protected Question newInstance(Map<String, Object> fields) {
        return Question.fromFields(fields);
    }

    @Override
    protected Question mapRow(ResultSet rs, int rowNum) throws SQLException {
        Question question = new Question();
        question.setId(rs.getLong("id"));
        question.setQuestionType(CodedValue.fromCode(QuestionType.class, rs.getString("question_type")));
        question.setReferenceCode(rs.getString("reference_code"));
        question.setText(rs.getString("text"));
        question.setValidationRules(readRules(rs.getString("validation_rules")));
        question.setStaffId(rs.getObject("staff_id", Long.class));
        question.setCreatedAt(toDateTime(rs.getTimestamp("created_at")));
        return question;
    }

    @Override
    protected Map<String, Object> toColumns(Question question) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("question_type", code(question.getQuestionType()));
        columns.put("reference_code", question.getReferenceCode());
        columns.put("text", question.getText());
        columns.put("validation_rules", writeRules(question.getValidationRules()));
        columns.put("staff_id", question.getStaffId());
        columns.put("created_at", toTimestamp(question.getCreatedAt()));
        return columns;
    }

    private Map<String, Object> readRules(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, RULES_TYPE);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Stored validation rules are not valid JSON", e);
        }
    }

    private String writeRules(Map<String, Object> rules) {
        try {
            return objectMapper.writeValueAsString(rules != null ? rules : Map.of());
        } catch (JsonProcessingException e) {
            throw new InvalidDataAccessApiUsageException("Validation rules cannot be written as JSON", e);
        }
    }
}
