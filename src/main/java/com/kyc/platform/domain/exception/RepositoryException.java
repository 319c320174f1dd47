package com.kyc.platform.domain.exception;

/**
 * Base type for every failure raised by the repository layer.
 */
public abstract class RepositoryException extends RuntimeException {

    protected RepositoryException(String message) {
        super(message);
    }

    protected RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
