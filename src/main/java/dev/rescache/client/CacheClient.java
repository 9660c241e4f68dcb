package dev.rescache.client;

import dev.rescache.api.ResultCache;
import dev.rescache.config.CacheConfig;
import dev.rescache.core.CoalescingResultCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * CacheClient manages named result caches using a Register + Get pattern.
 * Each name maps to one cache instance, created on first use from its registered configuration.
 *
 * <p><strong>Usage Pattern:</strong>
 * <pre>{@code
 * // 1. Register caches with their configuration
 * client.registerCache("profiles", new CacheConfig().setTtlMillis(30_000));
 * client.registerCache("quotes", CacheConfig.fromJson("{\"ttl\": -1, \"max_evicted\": 10}"));
 *
 * // 2. Get type-safe cache instances
 * ResultCache<String, Profile> profiles = client.getCache("profiles");
 * }</pre>
 */
public class CacheClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CacheClient.class);

    private final Clock clock;
    private final Map<String, CacheConfig> registrations = new ConcurrentHashMap<>();
    private final Map<String, ResultCache<?, ?>> activeCaches = new ConcurrentHashMap<>();

    public CacheClient() {
        this(null);
    }

    /**
     * @param clock the clock handed to every cache this client creates, null for system UTC
     */
    public CacheClient(Clock clock) {
        this.clock = clock;
    }

    /**
     * Registers a named cache with its configuration.
     * This must be called before {@link #getCache(String)}.
     *
     * <p>The configuration is copied under the registered name, so later changes to {@code config}
     * do not affect the registration.
     *
     * @param name   the cache name
     * @param config the cache configuration
     * @throws IllegalArgumentException if name is empty or the configuration is invalid
     * @throws IllegalStateException    if name is already registered with a different configuration
     */
    public void registerCache(String name, CacheConfig config) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(config, "config cannot be null");

        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty or whitespace");
        }

        CacheConfig registered = new CacheConfig()
                .setName(name)
                .setTtlMillis(config.getTtlMillis())
                .setMaxEvicted(config.getMaxEvicted())
                .setScanIntervalMillis(config.getScanIntervalMillis())
                .validate();

        CacheConfig existing = registrations.putIfAbsent(name, registered);
        if (existing != null) {
            if (!existing.equals(registered)) {
                throw new IllegalStateException(
                        String.format("Cache '%s' already registered with a different configuration. " +
                                        "Existing: %s, Requested: %s",
                                name, existing, registered));
            }
            return;
        }
        logger.info("Registered cache '{}' (ttl={}ms, max_evicted={}, scan_itv={}ms)", name,
                registered.getTtlMillis(), registered.getMaxEvicted(), registered.getScanIntervalMillis());
    }

    /**
     * Gets the cache instance registered under {@code name}, creating it on first use.
     *
     * @param name the cache name
     * @param <K>  the key type
     * @param <V>  the value type
     * @return the shared cache instance for the name
     * @throws IllegalArgumentException if name is empty
     * @throws IllegalStateException    if name is not registered
     */
    @SuppressWarnings("unchecked")
    public <K, V> ResultCache<K, V> getCache(String name) {
        Objects.requireNonNull(name, "name cannot be null");

        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty or whitespace");
        }

        CacheConfig config = registrations.get(name);
        if (config == null) {
            throw new IllegalStateException(
                    String.format("Cache '%s' not registered. Call registerCache() first.", name));
        }

        return (ResultCache<K, V>) activeCaches.computeIfAbsent(name,
                n -> new CoalescingResultCache<>(config, clock));
    }

    /**
     * Returns whether a cache name is registered.
     */
    public boolean isRegistered(String name) {
        return registrations.containsKey(name);
    }

    public int getRegisteredCacheCount() {
        return registrations.size();
    }

    @Override
    public void close() {
        activeCaches.values().forEach(ResultCache::clear);
        logger.info("Closed cache client, released {} cache(s)", activeCaches.size());

        activeCaches.clear();
        registrations.clear();
    }
}
