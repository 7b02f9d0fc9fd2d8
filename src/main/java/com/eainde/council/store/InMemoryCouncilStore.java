package com.eainde.council.store;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Process-local store. Records are immutable, so they are kept as-is without copying.
 */
@Component
@ConditionalOnProperty(name = "council.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryCouncilStore implements CouncilStore {

    private final Map<EntityKind, Map<String, Object>> data = new EnumMap<>(EntityKind.class);

    public InMemoryCouncilStore() {
        for (EntityKind kind : EntityKind.values()) {
            data.put(kind, new ConcurrentHashMap<>());
        }
    }

    @Override
    public <T> void put(EntityKind kind, String id, T record) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(record, "record");
        data.get(kind).put(id, record);
    }

    @Override
    public <T> Optional<T> get(EntityKind kind, String id, Class<T> type) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(data.get(kind).get(id)).map(type::cast);
    }

    @Override
    public <T> List<T> list(EntityKind kind, Class<T> type, Predicate<? super T> filter) {
        return data.get(kind).values().stream()
                .map(type::cast)
                .filter(filter)
                .collect(Collectors.toList());
    }
}
