package dev.rescache.api;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Request-coalescing result cache semantics:
 * - At most one producer invocation runs per key at a time. Callers arriving while it runs attach to it
 *   and receive the same value or the same failure.
 * - Completed results are kept according to the configured ttl: 0 disables caching, a negative ttl keeps
 *   results until a periodic scan evicts the oldest ones, a positive ttl expires results that many
 *   milliseconds after they were produced.
 * - Stale records are evicted lazily, a bounded number per scan, by the calls themselves.
 *   No background thread is involved.
 * - Failures are never cached: the next call after a failed invocation runs the producer again.
 * - Waiters are completed before the caller that started the invocation, in attach order. Callers must
 *   not rely on any completion order between callers sharing an invocation.
 */
public interface ResultCache<K, V> {
    /**
     * Returns the value for {@code key}, invoking {@code fetch} only when no in-flight or still-valid
     * result exists for it.
     *
     * @param key   the cache key (must not be null)
     * @param fetch the asynchronous producer, invoked with no arguments (must not be null)
     * @return a future completed with the produced value, or exceptionally with the producer's own error
     */
    CompletableFuture<V> get(K key, Supplier<? extends CompletionStage<V>> fetch);

    int size();

    int inFlightCount();

    int queueLength();

    /**
     * Drops every completed record and empties the eviction queue. In-flight invocations are left alone.
     */
    void clear();
}
