package com.kyc.platform.domain.model;

public enum QuestionnaireType implements CodedValue {
    REGULAR("regular"),
    VERIFICATION("verification"),
    MANDATORY("mandatory");

    private final String code;

    QuestionnaireType(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
