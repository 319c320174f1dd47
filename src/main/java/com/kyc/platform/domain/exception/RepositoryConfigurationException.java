package com.kyc.platform.domain.exception;

public class RepositoryConfigurationException extends RepositoryException {

    public RepositoryConfigurationException(String message) {
        super(message);
    }
}
