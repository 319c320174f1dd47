package com.kyc.platform.domain.model;

/**
 * Input widget a question is answered with.
 */
public enum QuestionType implements CodedValue {
    TEXT("text"),
    CHECKBOX("checkbox"),
    DROPDOWN("dropdown"),
    FILE("file"),
    DATE("date"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    URL("url"),
    MULTIPLE_CHOICE("multiple_choice"),
    RATING("rating"),
    DATETIME("datetime"),
    TIME("time"),
    PARAGRAPH("paragraph"),
    SLIDER("slider"),
    SIGNATURE("signature");

    private final String code;

    QuestionType(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
