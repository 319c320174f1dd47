package com.kyc.platform.domain.model;

import java.util.Map;

/**
 * Places a question inside a questionnaire at a given position.
 * A question appears at most once per questionnaire and positions do not collide.
 */
public class QuestionnaireItem extends BaseEntity {

    public static final EntityDescriptor<QuestionnaireItem> DESCRIPTOR =
            new EntityDescriptor<>(QuestionnaireItem.class, "questionnaireitem", "questionnaire");

    private Long questionnaireId;
    private Long questionId;
    private Integer orderIndex;

    public static QuestionnaireItem fromFields(Map<String, Object> fields) {
        QuestionnaireItem item = new QuestionnaireItem();
        item.applyFields(fields);
        requirePresent("questionnaire_id", item.questionnaireId);
        requirePresent("question_id", item.questionId);
        requirePresent("order_index", item.orderIndex);
        return item;
    }

    @Override
    protected boolean applyField(String field, Object value) {
        switch (field) {
            case "questionnaire_id" -> this.questionnaireId = asLong(field, value);
            case "question_id" -> this.questionId = asLong(field, value);
            case "order_index" -> this.orderIndex = asNonNegativeInteger(field, value);
            default -> {
                return false;
            }
        }
        return true;
    }

    public Long getQuestionnaireId() {
        return questionnaireId;
    }

    public void setQuestionnaireId(Long questionnaireId) {
        this.questionnaireId = questionnaireId;
    }

    public Long getQuestionId() {
        return questionId;
    }

    public void setQuestionId(Long questionId) {
        this.questionId = questionId;
    }

    public Integer getOrderIndex() {
        return orderIndex;
    }

    public void setOrderIndex(Integer orderIndex) {
        this.orderIndex = orderIndex;
    }

    @Override
    public String toString() {
        return questionnaireId + " - " + questionId + " @ " + orderIndex;
    }
}
