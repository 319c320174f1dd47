package com.kyc.platform.domain.port.out;

import java.util.List;
import java.util.Optional;

/**
 * Lazily evaluated selection of entities, ordered by primary key.
 * Nothing touches the datastore until one of the terminal methods runs.
 */
public interface EntityQuery<T> {

    long count();

    Optional<T> first();

    /**
     * @param offset number of matching entities to skip
     * @param limit  maximum number to return, {@code null} for no limit
     */
    List<T> slice(long offset, Integer limit);

    default List<T> list() {
        return slice(0, null);
    }
}
