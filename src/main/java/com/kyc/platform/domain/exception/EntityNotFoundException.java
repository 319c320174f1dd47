package com.kyc.platform.domain.exception;

/**
 * A referenced entity does not exist.
 */
public class EntityNotFoundException extends RepositoryException {

    public EntityNotFoundException(String entityName, long id) {
        super(String.format("%s with ID %d not found", entityName, id));
    }
}
