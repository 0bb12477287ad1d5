package io.gamevault.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Fixed-capacity cache with least-recently-used eviction.
 * <p>
 * Semantics:
 *  - get()/containsKey() bump recency of the touched entry.
 *  - put() inserts or replaces unconditionally; at capacity the least
 *    recently used entry is evicted.
 *  - putIf() is an atomic compare-and-put: the predicate sees the value
 *    currently held (or null) and the candidate, and the put happens only
 *    if it returns true.
 *  - reset() drops everything.
 * <p>
 * Implementation notes:
 *  - Backed by an access-ordered LinkedHashMap.
 *  - Every method is synchronized on this instance, so a putIf() decision is
 *    never made against a value that another thread has already replaced.
 *  - Capacity is fixed at construction.
 */
public final class LruCache<K, V> {

    private final int capacity;
    private final LinkedHashMap<K, V> entries;

    public LruCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > LruCache.this.capacity;
            }
        };
    }

    /** @return cached value or null if absent. */
    public synchronized V get(K key) {
        Objects.requireNonNull(key, "key");
        return entries.get(key);
    }

    public synchronized void put(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        entries.put(key, value);
    }

    public synchronized boolean containsKey(K key) {
        Objects.requireNonNull(key, "key");
        // LinkedHashMap.containsKey does not touch access order; get() does.
        return entries.get(key) != null;
    }

    /**
     * Put {@code candidate} only if {@code accept.test(current, candidate)} holds.
     *
     * @return true if the candidate was stored
     */
    public synchronized boolean putIf(K key, V candidate, BiPredicate<? super V, ? super V> accept) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(candidate, "candidate");
        V current = entries.get(key);
        if (!accept.test(current, candidate)) {
            return false;
        }
        entries.put(key, candidate);
        return true;
    }

    public synchronized void reset() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }
}
