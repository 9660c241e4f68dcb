package dev.rescache.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.Map;
import java.util.Objects;

@Getter
@Setter
@Accessors(chain = true)
@EqualsAndHashCode
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class CacheConfig {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    // System property helpers for test configurability (safe fallbacks)
    private static String prop(String key, String def) {
        String v = System.getProperty(key);
        return v == null ? def : v;
    }
    private static int intProp(String key, int def) {
        String v = System.getProperty(key);
        if (v == null) return def;
        try { return Integer.parseInt(v.trim()); } catch (NumberFormatException e) { return def; }
    }
    private static long longProp(String key, long def) {
        String v = System.getProperty(key);
        if (v == null) return def;
        try { return Long.parseLong(v.trim()); } catch (NumberFormatException e) { return def; }
    }

    // Identity (logging, registry)
    @JsonProperty("name")
    private String name = prop("rc.name", "default");

    // 0 = no caching, negative = evict oldest N per scan, positive = expire that many millis after creation
    @JsonProperty("ttl")
    private long ttlMillis = longProp("rc.ttl", 0L);

    // Scanner
    @JsonProperty("max_evicted")
    private int maxEvicted = intProp("rc.maxEvicted", 2);       // records removed per scan pass
    @JsonProperty("scan_itv")
    private long scanIntervalMillis = longProp("rc.scanInterval", 60_000L); // minimum gap between scan passes

    /**
     * Builds a config from the option names used on the wire ({@code ttl}, {@code max_evicted},
     * {@code scan_itv}, {@code name}). Missing options keep their defaults, unknown ones are ignored.
     */
    public static CacheConfig fromOptions(Map<String, ?> options) {
        Objects.requireNonNull(options, "options cannot be null");
        try {
            return MAPPER.convertValue(options, CacheConfig.class);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cache options: " + options, e);
        }
    }

    public static CacheConfig fromJson(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        try {
            return MAPPER.readValue(json, CacheConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse cache options from JSON", e);
        }
    }

    /**
     * @throws IllegalArgumentException if a limit is negative or the name is blank
     */
    public CacheConfig validate() {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("name cannot be null, empty or whitespace");
        }
        if (maxEvicted < 0) {
            throw new IllegalArgumentException("max_evicted must be >= 0, got " + maxEvicted);
        }
        if (scanIntervalMillis < 0) {
            throw new IllegalArgumentException("scan_itv must be >= 0, got " + scanIntervalMillis);
        }
        return this;
    }
}
