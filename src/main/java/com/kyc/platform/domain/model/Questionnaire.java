package com.kyc.platform.domain.model;

import java.util.Map;

/**
 * A form made of ordered questions, defined by staff and filled in by users.
 */
public class Questionnaire extends BaseEntity {

    public static final EntityDescriptor<Questionnaire> DESCRIPTOR =
            EntityDescriptor.of(Questionnaire.class, "questionnaire");

    private String name;
    private String about;
    private QuestionnaireType questionnaireType;
    private QuestionnaireScope questionnaireScope = QuestionnaireScope.DRAFT;
    private Long staffId;

    /**
     * Build a new, not yet stored questionnaire from a field map.
     */
    public static Questionnaire fromFields(Map<String, Object> fields) {
        Questionnaire questionnaire = new Questionnaire();
        questionnaire.applyFields(fields);
        requirePresent("name", questionnaire.name);
        requirePresent("questionnaire_type", questionnaire.questionnaireType);
        return questionnaire;
    }

    @Override
    protected boolean applyField(String field, Object value) {
        switch (field) {
            case "name" -> this.name = asString(field, value, 255);
            case "about" -> this.about = asString(field, value, 255);
            case "questionnaire_type" -> this.questionnaireType = asCoded(field, value, QuestionnaireType.class);
            case "questionnaire_scope" -> {
                QuestionnaireScope scope = asCoded(field, value, QuestionnaireScope.class);
                this.questionnaireScope = scope != null ? scope : QuestionnaireScope.DRAFT;
            }
            case "staff_id" -> this.staffId = asLong(field, value);
            default -> {
                return false;
            }
        }
        return true;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getAbout() {
        return about;
    }

    public void setAbout(String about) {
        this.about = about;
    }

    public QuestionnaireType getQuestionnaireType() {
        return questionnaireType;
    }

    public void setQuestionnaireType(QuestionnaireType questionnaireType) {
        this.questionnaireType = questionnaireType;
    }

    public QuestionnaireScope getQuestionnaireScope() {
        return questionnaireScope;
    }

    public void setQuestionnaireScope(QuestionnaireScope questionnaireScope) {
        this.questionnaireScope = questionnaireScope;
    }

    public Long getStaffId() {
        return staffId;
    }

    public void setStaffId(Long staffId) {
        this.staffId = staffId;
    }

    @Override
    public String toString() {
        return String.format("%s (Type: %s, Scope: %s)", name,
                questionnaireType != null ? questionnaireType.code() : null,
                questionnaireScope != null ? questionnaireScope.code() : null);
    }
}
