package com.kyc.platform.domain.model;

import com.kyc.platform.domain.exception.EntityValidationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A reusable question item that can appear in many questionnaires.
 */
public class Question extends BaseEntity {

    public static final EntityDescriptor<Question> DESCRIPTOR =
            EntityDescriptor.of(Question.class, "questionnaire");

    private QuestionType questionType;
    private String referenceCode;
    private String text;
    private Map<String, Object> validationRules = new LinkedHashMap<>();
    private Long staffId;

    public static Question fromFields(Map<String, Object> fields) {
        Question question = new Question();
        question.applyFields(fields);
        requirePresent("question_type", question.questionType);
        requirePresent("reference_code", question.referenceCode);
        requirePresent("text", question.text);
        return question;
    }

    @Override
    protected boolean applyField(String field, Object value) {
        switch (field) {
            case "question_type" -> this.questionType = asCoded(field, value, QuestionType.class);
            case "reference_code" -> this.referenceCode = asString(field, value, 50);
            case "text" -> this.text = asString(field, value, 255);
            case "validation_rules" -> this.validationRules = asRules(value);
            case "staff_id" -> this.staffId = asLong(field, value);
            default -> {
                return false;
            }
        }
        return true;
    }

    private static Map<String, Object> asRules(Object value) {
        if (value == null) {
            return new LinkedHashMap<>();
        }
        if (!(value instanceof Map<?, ?> rules)) {
            throw new EntityValidationException("Field 'validation_rules' must be a mapping, got "
                    + value.getClass().getSimpleName());
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        rules.forEach((key, rule) -> copy.put(String.valueOf(key), rule));
        return copy;
    }

    public QuestionType getQuestionType() {
        return questionType;
    }

    public void setQuestionType(QuestionType questionType) {
        this.questionType = questionType;
    }

    public String getReferenceCode() {
        return referenceCode;
    }

    public void setReferenceCode(String referenceCode) {
        this.referenceCode = referenceCode;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public Map<String, Object> getValidationRules() {
        return validationRules;
    }

    public void setValidationRules(Map<String, Object> validationRules) {
        this.validationRules = validationRules;
    }

    public Long getStaffId() {
        return staffId;
    }

    public void setStaffId(Long staffId) {
        this.staffId = staffId;
    }

    @Override
    public String toString() {
        return String.format("Question [%s] (%s)", referenceCode,
                questionType != null ? questionType.code() : null);
    }
}
