package com.camsnapshot.camsnapshot.service.cache;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Process-wide keyed store with no persistence guarantee. Entries live until they
 * are deleted or the process restarts.
 */
public interface EphemeralCache<V> {

    Optional<V> get(String key);

    V getOrDefault(String key, V defaultValue);

    /** Returns the cached value, loading and caching it when absent. A null load is not cached. */
    Optional<V> getOrCompute(String key, Function<String, V> loader);

    void put(String key, V value);

    void delete(String key);

    /** Applies {@code update} to the current value (or {@code defaultValue}) atomically for this key. */
    V update(String key, V defaultValue, UnaryOperator<V> update);
}
