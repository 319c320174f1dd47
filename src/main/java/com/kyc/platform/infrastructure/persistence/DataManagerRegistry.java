package com.kyc.platform.infrastructure.persistence;

import com.kyc.platform.domain.model.Entity;
import com.kyc.platform.domain.port.out.DataManager;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up the {@link DataManager} responsible for an entity type.
 */
@Component
public class DataManagerRegistry {

    private final Map<Class<?>, DataManager<?>> managers = new HashMap<>();

    public DataManagerRegistry(List<DataManager<?>> managers) {
        for (DataManager<?> manager : managers) {
            DataManager<?> previous = this.managers.put(manager.managedType(), manager);
            if (previous != null) {
                throw new IllegalStateException("Duplicate DataManager for " + manager.managedType().getSimpleName());
            }
        }
    }

    public <T extends Entity> Optional<DataManager<T>> find(Class<T> type) {
        DataManager<?> manager = managers.get(type);
        if (manager == null || manager.managedType() != type) {
            return Optional.empty();
        }
        // managedType() is exactly T, so the manager handles T
        @SuppressWarnings("unchecked")
        DataManager<T> typed = (DataManager<T>) manager;
        return Optional.of(typed);
    }
}
