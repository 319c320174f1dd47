package com.kyc.platform.domain.model;

import com.kyc.platform.domain.exception.EntityValidationException;

/**
 * Enumerated value stored by its short code (e.g. "draft").
 */
public interface CodedValue {

    String code();

    static <E extends Enum<E> & CodedValue> E fromCode(Class<E> type, String code) {
        for (E constant : type.getEnumConstants()) {
            if (constant.code().equals(code)) {
                return constant;
            }
        }
        throw new EntityValidationException(
                String.format("Invalid %s value '%s'", type.getSimpleName(), code));
    }
}
