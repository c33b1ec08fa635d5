package com.camsnapshot.camsnapshot.service.cache;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.UnaryOperator;

public class InMemoryEphemeralCache<V> implements EphemeralCache<V> {

    private final String name;
    private final Map<String, V> entries = new ConcurrentHashMap<>();

    public InMemoryEphemeralCache(String name) {
        this.name = name;
    }

    public int size() {
        return entries.size();
    }

    @Override
    public Optional<V> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public V getOrDefault(String key, V defaultValue) {
        return entries.getOrDefault(key, defaultValue);
    }

    @Override
    public Optional<V> getOrCompute(String key, Function<String, V> loader) {
        V cached = entries.get(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        // Loaded outside the map so a slow loader never holds a bin lock
        V loaded = loader.apply(key);
        if (loaded == null) {
            return Optional.empty();
        }
        V raced = entries.putIfAbsent(key, loaded);
        return Optional.of(raced != null ? raced : loaded);
    }

    @Override
    public void put(String key, V value) {
        entries.put(key, value);
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    @Override
    public V update(String key, V defaultValue, UnaryOperator<V> update) {
        return entries.compute(key, (k, current) -> update.apply(current != null ? current : defaultValue));
    }

    @Override
    public String toString() {
        return "InMemoryEphemeralCache[" + name + ", " + entries.size() + " entries]";
    }
}
