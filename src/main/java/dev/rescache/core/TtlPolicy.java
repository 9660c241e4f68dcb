package dev.rescache.core;

/**
 * How completed results are kept, derived from the configured ttl.
 */
public enum TtlPolicy {
    /** ttl == 0: results are handed out and dropped, nothing is cached or scanned. */
    DISABLED,
    /** ttl &lt; 0: results never expire on read; each scan pass evicts the oldest records unconditionally. */
    PERIODIC,
    /** ttl &gt; 0: results expire ttl millis after creation, on read or by a scan pass. */
    EXPIRING;

    public static TtlPolicy of(long ttlMillis) {
        if (ttlMillis == 0) return DISABLED;
        return ttlMillis < 0 ? PERIODIC : EXPIRING;
    }
}
