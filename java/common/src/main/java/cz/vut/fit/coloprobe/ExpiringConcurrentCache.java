package cz.vut.fit.coloprobe;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.Closeable;
import java.util.concurrent.*;

/**
 * A thread-safe map whose entries are evicted after not being read for a given lifetime.
 * Eviction runs periodically on a single daemon thread owned by the cache.
 *
 * @param <K> The key type.
 * @param <V> The value type.
 */
public class ExpiringConcurrentCache<K, V> implements Closeable {
    private static class Entry<V> {
        volatile long _lastAccessed;
        final V _value;

        Entry(V value) {
            _lastAccessed = System.nanoTime();
            _value = value;
        }

        V getValue() {
            _lastAccessed = System.nanoTime();
            return _value;
        }
    }

    private final ConcurrentMap<K, Entry<V>> _cache = new ConcurrentHashMap<>();
    private final ScheduledExecutorService _scheduler;
    private final long _lifetime;

    public ExpiringConcurrentCache(long entryLifetime, long checkInterval, @NotNull TimeUnit timeUnit) {
        _lifetime = timeUnit.toNanos(entryLifetime);
        _scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            var thread = new Thread(runnable, "cache-eviction");
            thread.setDaemon(true);
            return thread;
        });
        _scheduler.scheduleAtFixedRate(this::removeExpiredEntries, checkInterval, checkInterval, timeUnit);
    }

    @Nullable
    public V get(@NotNull K key) {
        var entry = _cache.get(key);
        if (entry == null)
            return null;

        // The entry may have outlived its lifetime between two eviction runs
        if (entry._lastAccessed < System.nanoTime() - _lifetime) {
            _cache.remove(key, entry);
            return null;
        }

        return entry.getValue();
    }

    public V put(@NotNull K key, @NotNull V value) {
        _cache.put(key, new Entry<>(value));
        return value;
    }

    public V putIfAbsent(@NotNull K key, @NotNull V value) {
        var entry = _cache.putIfAbsent(key, new Entry<>(value));
        return entry == null ? value : entry._value;
    }

    public int size() {
        return _cache.size();
    }

    void removeExpiredEntries() {
        long expirationThreshold = System.nanoTime() - _lifetime;
        _cache.entrySet().removeIf(entry -> entry.getValue()._lastAccessed < expirationThreshold);
    }

    @Override
    public void close() {
        _scheduler.shutdown();
    }
}
