package dev.rescache.core;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A key's entry in the record store: either an in-flight invocation with its waiters, or a completed result.
 *
 * @param <V> the type of the cached value
 */
interface CacheRecord<V> {

    /**
     * Producer running. Waiters are completed in attach order once it settles.
     */
    final class Pending<V> implements CacheRecord<V> {
        private final List<CompletableFuture<V>> waiters = new ArrayList<>();

        CompletableFuture<V> attach() {
            CompletableFuture<V> waiter = new CompletableFuture<>();
            waiters.add(waiter);
            return waiter;
        }

        List<CompletableFuture<V>> drain() {
            List<CompletableFuture<V>> drained = new ArrayList<>(waiters);
            waiters.clear();
            return drained;
        }
    }

    /**
     * Produced value with its creation time and the absolute index of its eviction queue slot.
     *
     * @param timestamp creation time (epoch millis)
     * @param data      the producer's result, may be null
     * @param idx       absolute slot index in the {@link EvictionQueue}
     */
    record Completed<V>(long timestamp, V data, long idx) implements CacheRecord<V> {
        boolean isExpired(long ttlMillis, long now) {
            // subtraction, so a very large ttl cannot wrap
            return now - timestamp > ttlMillis;
        }
    }

    static <V> Pending<V> pending() {
        return new Pending<>();
    }

    static <V> Completed<V> completed(long timestamp, V data, long idx) {
        if (idx < 0) {
            throw new IllegalArgumentException("idx must be >= 0, got " + idx);
        }
        return new Completed<>(timestamp, data, idx);
    }
}
