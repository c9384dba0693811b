package com.typeresolve.engine.graph;

import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Memoizes query results per key and graph revision. The first read after a mutation drops
 * every entry from older revisions, so the map only ever holds keys queried at the current revision.
 *
 * Failed computations are not cached; the exception reaches the caller every time.
 */
public final class RevisionCache<K, V> {

    /** Value tagged with the revision it was computed at. */
    record Entry<V>(long revision, V value) {}

    private final DeclarationGraph graph;
    private final boolean enabled;
    private final ConcurrentHashMap<K, Entry<V>> entries = new ConcurrentHashMap<>();
    private volatile long entriesRevision = -1;

    public RevisionCache(DeclarationGraph graph, boolean enabled) {
        this.graph = graph;
        this.enabled = enabled;
    }

    /**
     * Returns the cached value for {@code key} at the current revision, computing it if absent or stale.
     * Runs under the graph's read lock so the revision cannot move during computation.
     */
    public V get(K key, Function<K, V> compute) {
        return graph.read(() -> {
            if (!enabled) {
                return compute.apply(key);
            }
            long current = graph.revision();
            if (current != entriesRevision) {
                evictStale(current);
            }
            Entry<V> entry = entries.get(key);
            if (entry != null && entry.revision() == current) {
                return entry.value();
            }
            V value = compute.apply(key);
            entries.put(key, new Entry<>(current, value));
            return value;
        });
    }

    // Caller holds the graph read lock, so the revision cannot move while evicting
    private void evictStale(long current) {
        synchronized (entries) {
            if (current != entriesRevision) {
                entries.clear();
                entriesRevision = current;
            }
        }
    }

    /** Number of slots held, stale ones included until the next read. */
    public int size() {
        return entries.size();
    }

    /** True if {@code key} has an entry computed at the current revision. */
    public boolean isFresh(K key) {
        Entry<V> entry = entries.get(key);
        return entry != null && entry.revision() == graph.revision();
    }
}
