package io.github.cyfko.prereq.core.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Thread-safe, size-bounded cache with least-recently-used eviction.
 * <p>
 * Used by the compiler to memoize compiled prerequisites by raw text. The mapping function of
 * {@link #computeIfAbsent(Object, Function)} runs outside the lock so that parallel crawl workers never
 * serialize on each other; two threads racing on the same key may both compute, and the first value
 * stored wins.
 * </p>
 *
 * @param <K> key type
 * @param <V> value type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BoundedLRUCache<K, V> {

    private final int maxSize;
    private final Map<K, V> entries;
    private final Lock lock = new ReentrantLock();

    /**
     * @param maxSize the maximum number of entries to keep
     * @throws IllegalArgumentException if maxSize is not positive
     */
    public BoundedLRUCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }
        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > BoundedLRUCache.this.maxSize;
            }
        };
    }

    /**
     * @param key the key to look up
     * @return the cached value, or {@code null}; a hit marks the entry as most recently used
     */
    public V get(K key) {
        lock.lock();
        try {
            return entries.get(key);
        } finally {
            lock.unlock();
        }
    }

    public void put(K key, V value) {
        lock.lock();
        try {
            entries.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cached value for {@code key}, computing and storing it on a miss.
     * Exceptions thrown by the mapping function propagate and nothing is stored.
     *
     * @param key             the key
     * @param mappingFunction computes the value on a miss
     * @return the cached or newly computed value
     */
    public V computeIfAbsent(K key, Function<K, V> mappingFunction) {
        V cached = get(key);
        if (cached != null) {
            return cached;
        }

        V computed = mappingFunction.apply(key);
        if (computed == null) {
            return null;
        }

        lock.lock();
        try {
            V raced = entries.putIfAbsent(key, computed);
            return raced != null ? raced : computed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int maxSize() {
        return maxSize;
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }
}
