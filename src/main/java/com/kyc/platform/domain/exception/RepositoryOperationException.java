package com.kyc.platform.domain.exception;

/**
 * Normalized failure of an otherwise valid repository call.
 * The message carries the underlying failure's message.
 */
public class RepositoryOperationException extends RepositoryException {

    public RepositoryOperationException(String message) {
        super(message);
    }

    public RepositoryOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
