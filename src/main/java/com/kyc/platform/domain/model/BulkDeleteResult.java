package com.kyc.platform.domain.model;

import java.util.List;

public record BulkDeleteResult<T>(List<T> deleted, int count) {

    public static <T> BulkDeleteResult<T> of(List<T> deleted) {
        return new BulkDeleteResult<>(List.copyOf(deleted), deleted.size());
    }
}
