package io.github.chirino.speakercache.cache;

import java.util.Map;

/**
 * Diagnostic snapshot of the tiered cache. Values may already be stale when read.
 *
 * @param configuredBackend backend named in configuration
 * @param activeBackend label of the store serving requests, {@code volatile} when none is durable
 * @param activeTier tier serving requests
 * @param status {@code connected} or {@code fallback_only}
 * @param volatileEntries entries currently held in process memory
 * @param backends per backend details keyed by backend label
 */
public record CacheInfo(
        String configuredBackend,
        String activeBackend,
        CacheTier activeTier,
        String status,
        int volatileEntries,
        Map<String, Map<String, Object>> backends) {

    public static final String VOLATILE_LABEL = "volatile";
    public static final String STATUS_CONNECTED = "connected";
    public static final String STATUS_FALLBACK_ONLY = "fallback_only";

    public CacheInfo {
        backends = Map.copyOf(backends);
    }
}
