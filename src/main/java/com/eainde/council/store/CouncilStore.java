package com.eainde.council.store;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Key-value persistence keyed by (kind, id). Writes overwrite, last writer wins; no transactions.
 */
public interface CouncilStore {

    <T> void put(EntityKind kind, String id, T record);

    <T> Optional<T> get(EntityKind kind, String id, Class<T> type);

    <T> List<T> list(EntityKind kind, Class<T> type, Predicate<? super T> filter);

    default <T> List<T> list(EntityKind kind, Class<T> type) {
        return list(kind, type, record -> true);
    }
}
