package com.kyc.platform.domain.exception;

/**
 * Malformed or missing caller input: bad id, empty field map, invalid list,
 * out-of-range pagination parameters. Never retried, never wrapped.
 */
public class EntityValidationException extends RepositoryException {

    public EntityValidationException(String message) {
        super(message);
    }
}
