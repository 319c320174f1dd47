package com.kyc.platform.domain.model;

/**
 * Publication state of a questionnaire.
 */
public enum QuestionnaireScope implements CodedValue {
    DRAFT("draft"),
    PUBLIC("public"),
    ASSIGNED("assigned");

    private final String code;

    QuestionnaireScope(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
