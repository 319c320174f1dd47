package com.kyc.platform.domain.model;

import java.util.List;

/**
 * One page of entities plus the numbers needed to navigate the rest.
 */
public record PageResult<T>(
        List<T> entities,
        long totalCount,
        int page,
        int perPage,
        int totalPages,
        boolean hasNext,
        boolean hasPrevious
) {
    public PageResult {
        entities = List.copyOf(entities);
    }

    public static <T> PageResult<T> of(List<T> entities, long totalCount, int page, int perPage) {
        int totalPages = (int) ((totalCount + perPage - 1) / perPage);
        return new PageResult<>(entities, totalCount, page, perPage, totalPages,
                page < totalPages, page > 1);
    }
}
