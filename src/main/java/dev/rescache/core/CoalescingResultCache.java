package dev.rescache.core;

import dev.rescache.api.ResultCache;
import dev.rescache.config.CacheConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * A request-coalescing, time-bounded result cache.
 *
 * <p>This implementation provides:
 * <ul>
 *   <li>Single-flight invocation: concurrent callers for a key share one producer call</li>
 *   <li>Fan-out of the one result, or the one failure, to every caller that attached</li>
 *   <li>Ttl-driven retention: disabled, periodic eviction of the oldest records, or expiry after creation</li>
 *   <li>Lazy eviction: each call first runs a throttled scan that evicts at most {@code max_evicted} records</li>
 * </ul>
 *
 * <p>Records are kept in a key-to-record map. Completed records also own a slot in a FIFO
 * {@link EvictionQueue}, in creation order, which the scan consumes from the front. A record that
 * expires on read tombstones its slot rather than removing it, so the remaining slots keep their indices.
 *
 * <p><strong>Thread Safety:</strong> the record map, the queue and the scan state are only touched while
 * holding this cache's monitor, which also covers the check-then-install of an in-flight record. The
 * producer runs, and waiters are completed, outside the monitor, so either may call back into the cache.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * CacheConfig config = new CacheConfig().setTtlMillis(5_000).setScanIntervalMillis(1_000);
 * ResultCache<String, Profile> cache = new CoalescingResultCache<>(config);
 *
 * CompletableFuture<Profile> profile = cache.get("user:42", () -> backend.loadProfileAsync("42"));
 * }</pre>
 *
 * @param <K> the type of the cache key
 * @param <V> the type of the cached value
 */
public class CoalescingResultCache<K, V> implements ResultCache<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(CoalescingResultCache.class);

    private final String name;
    private final long ttlMillis;
    private final TtlPolicy policy;
    private final int maxEvicted;
    private final long scanIntervalMillis;
    private final Clock clock;
    private final Object lock = new Object();

    // guarded by lock
    private final Map<K, CacheRecord<V>> store = new HashMap<>();
    private final EvictionQueue<K> queue = new EvictionQueue<>();
    private long lastEvicted = 0;

    /**
     * Creates a cache on the system UTC clock.
     *
     * @param config the cache configuration
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public CoalescingResultCache(CacheConfig config) {
        this(config, null);
    }

    /**
     * Creates a cache on the given clock.
     *
     * @param config the cache configuration
     * @param clock  the clock used for record timestamps and scan throttling, null for system UTC
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public CoalescingResultCache(CacheConfig config, Clock clock) {
        Objects.requireNonNull(config, "config cannot be null").validate();

        this.name = config.getName();
        this.ttlMillis = config.getTtlMillis();
        this.policy = TtlPolicy.of(ttlMillis);
        this.maxEvicted = config.getMaxEvicted();
        this.scanIntervalMillis = config.getScanIntervalMillis();
        this.clock = (clock != null) ? clock : Clock.systemUTC();

        MDC.put("cacheName", name);
        try {
            logger.info("Initialized result cache '{}' with policy {} (ttl={}ms, max_evicted={}, scan_itv={}ms)",
                    name, policy, ttlMillis, maxEvicted, scanIntervalMillis);
        } finally {
            MDC.remove("cacheName");
        }
    }

    @Override
    public CompletableFuture<V> get(K key, Supplier<? extends CompletionStage<V>> fetch) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(fetch, "fetch cannot be null");

        CacheRecord.Pending<V> started;
        synchronized (lock) {
            shrink();

            CacheRecord<V> rec = store.get(key);
            if (rec instanceof CacheRecord.Pending) {
                logger.trace("Attaching waiter to in-flight invocation for key '{}' in cache '{}'", key, name);
                return ((CacheRecord.Pending<V>) rec).attach();
            }

            if (rec != null) {
                CacheRecord.Completed<V> done = (CacheRecord.Completed<V>) rec;
                if (policy != TtlPolicy.EXPIRING || !done.isExpired(ttlMillis, clock.millis())) {
                    logger.trace("Cache hit for key '{}' in cache '{}'", key, name);
                    return CompletableFuture.completedFuture(done.data());
                }

                // Expired on read: tombstone the slot so the scan skips it, then refetch.
                queue.tombstone(done.idx());
                store.remove(key);
                logger.debug("Record for key '{}' in cache '{}' expired on read, slot {} tombstoned",
                        key, name, done.idx());
            }

            started = CacheRecord.pending();
            store.put(key, started);
        }

        return invoke(key, started, fetch);
    }

    private CompletableFuture<V> invoke(K key, CacheRecord.Pending<V> record,
                                        Supplier<? extends CompletionStage<V>> fetch) {
        CompletableFuture<V> result = new CompletableFuture<>();
        CompletionStage<V> stage;
        try {
            stage = Objects.requireNonNull(fetch.get(), "fetch returned a null stage");
        } catch (Throwable t) {
            settle(key, record, null, unwrap(t), result);
            return result;
        }

        stage.whenComplete((value, error) -> settle(key, record, value, unwrap(error), result));
        return result;
    }

    /**
     * Replaces the in-flight record and drains its waiters in one step under the monitor, then completes the
     * waiters followed by the originating caller's future.
     */
    private void settle(K key, CacheRecord.Pending<V> record, V value, Throwable error,
                        CompletableFuture<V> result) {
        List<CompletableFuture<V>> waiters;
        synchronized (lock) {
            waiters = record.drain();
            if (store.get(key) == record) {
                if (error != null || policy == TtlPolicy.DISABLED) {
                    store.remove(key);
                } else {
                    long idx = queue.append(key);
                    store.put(key, CacheRecord.completed(clock.millis(), value, idx));
                }
            }
        }

        if (error != null) {
            logger.debug("Producer failed for key '{}' in cache '{}', notifying {} waiter(s): {}",
                    key, name, waiters.size(), error.toString());
            for (CompletableFuture<V> waiter : waiters) {
                waiter.completeExceptionally(error);
            }
            result.completeExceptionally(error);
            return;
        }

        for (CompletableFuture<V> waiter : waiters) {
            waiter.complete(value);
        }
        result.complete(value);
    }

    /**
     * Runs one scan pass if the scan interval has elapsed since the last one.
     *
     * @return the number of records evicted
     */
    private int shrink() {
        if (policy == TtlPolicy.DISABLED) {
            return 0;
        }

        long now = clock.millis();
        if (now - lastEvicted < scanIntervalMillis) {
            return 0;
        }
        lastEvicted = now;

        int evicted = 0;
        while (evicted < maxEvicted) {
            EvictionQueue.Slot<K> slot = queue.pollFirst();
            if (slot == null) {
                break;
            }
            if (slot.isTombstone()) {
                continue;
            }

            CacheRecord<V> rec = store.get(slot.key());
            if (!(rec instanceof CacheRecord.Completed)
                    || ((CacheRecord.Completed<V>) rec).idx() != slot.index()) {
                // slot no longer backs a record
                continue;
            }

            CacheRecord.Completed<V> done = (CacheRecord.Completed<V>) rec;
            if (policy == TtlPolicy.EXPIRING && !done.isExpired(ttlMillis, now)) {
                // Everything behind this slot is newer, so nothing else can be expired.
                queue.pushFirst(slot);
                break;
            }

            store.remove(slot.key());
            evicted++;
        }

        if (evicted > 0) {
            logger.debug("Scan evicted {} record(s) from cache '{}', {} remaining", evicted, name, store.size());
        }
        return evicted;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    @Override
    public int size() {
        synchronized (lock) {
            return store.size();
        }
    }

    @Override
    public int inFlightCount() {
        synchronized (lock) {
            int pending = 0;
            for (CacheRecord<V> rec : store.values()) {
                if (rec instanceof CacheRecord.Pending) pending++;
            }
            return pending;
        }
    }

    @Override
    public int queueLength() {
        synchronized (lock) {
            return queue.size();
        }
    }

    @Override
    public void clear() {
        synchronized (lock) {
            int before = store.size();
            store.values().removeIf(rec -> rec instanceof CacheRecord.Completed);
            queue.clear();
            logger.debug("Cleared {} completed record(s) from cache '{}'", before - store.size(), name);
        }
    }

    public String getName() {
        return name;
    }

    public TtlPolicy getPolicy() {
        return policy;
    }
}
