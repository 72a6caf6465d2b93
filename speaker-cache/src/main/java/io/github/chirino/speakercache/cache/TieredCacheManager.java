package io.github.chirino.speakercache.cache;

import io.github.chirino.speakercache.codec.SpeakerEmbedding;
import io.github.chirino.speakercache.config.CacheBackendSelector;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Stores speaker embeddings in the best available tier: the configured durable backend, then the
 * other durable backend, then process memory.
 *
 * <p>The active tier is chosen at startup and moves down whenever the active backend reports a
 * connectivity failure or timeout; the interrupted operation is then retried on the next tier.
 * Moving back up only happens through {@link #reprobe()}, after a higher tier answered {@code
 * promotionThreshold} consecutive probes.
 *
 * <p>While the primary tier is not active, every key written or deleted is remembered together with
 * the tier that took the write. Before a tier is promoted those keys are reconciled onto it: the
 * latest value is written back with its remaining TTL, and deleted or lost keys are deleted there,
 * so entries the promoted tier still holds from before the outage cannot resurface.
 *
 * <p>Backend failures are never thrown to callers. The only exception raised on purpose is {@link
 * SpeakerEmbeddingNotFoundException} from {@link #getCachedEmbeddingOrFail(String)}.
 */
@Startup
@ApplicationScoped
public class TieredCacheManager {
    private static final Logger LOG = Logger.getLogger(TieredCacheManager.class);

    public static final long DEFAULT_TTL_SECONDS = 2_592_000L;

    private final String configuredBackend;
    private final Map<CacheTier, SpeakerEmbeddingStore> durableStores =
            new EnumMap<>(CacheTier.class);
    private final VolatileSpeakerEmbeddingStore volatileStore;
    private final Duration defaultTtl;
    private final int promotionThreshold;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final AtomicReference<CacheTier> activeTier = new AtomicReference<>(CacheTier.VOLATILE);
    private final Map<CacheTier, Integer> healthyProbes = new EnumMap<>(CacheTier.class);
    private final Map<String, PendingWrite> pendingWrites = new ConcurrentHashMap<>();
    // Writers share the read side; promotion takes the write side while it reconciles.
    private final ReentrantReadWriteLock promotionLock = new ReentrantReadWriteLock();
    private Counter durableHits;
    private Counter volatileHits;
    private Counter misses;
    private Counter fallbackWrites;
    private Counter corruptReads;
    private Counter reconciledKeys;

    @Inject
    public TieredCacheManager(
            CacheBackendSelector selector,
            @ConfigProperty(name = "speaker-cache.default-ttl-seconds", defaultValue = "2592000")
                    long defaultTtlSeconds,
            @ConfigProperty(name = "speaker-cache.health.promotion-threshold", defaultValue = "3")
                    int promotionThreshold,
            MeterRegistry meterRegistry,
            Clock clock) {
        this(
                selector.getConfiguredBackend(),
                selector.getPrimary(),
                selector.getSecondary(),
                new VolatileSpeakerEmbeddingStore(clock),
                Duration.ofSeconds(defaultTtlSeconds),
                promotionThreshold,
                meterRegistry,
                clock);
    }

    public TieredCacheManager(
            String configuredBackend,
            SpeakerEmbeddingStore primary,
            SpeakerEmbeddingStore secondary,
            VolatileSpeakerEmbeddingStore volatileStore,
            Duration defaultTtl,
            int promotionThreshold,
            MeterRegistry meterRegistry,
            Clock clock) {
        CacheEntry.requirePositive(defaultTtl);
        if (promotionThreshold < 1) {
            throw new IllegalArgumentException(
                    "speaker-cache.health.promotion-threshold must be >= 1: "
                            + promotionThreshold);
        }
        this.configuredBackend = configuredBackend;
        this.durableStores.put(CacheTier.PRIMARY, primary);
        this.durableStores.put(CacheTier.SECONDARY, secondary);
        this.volatileStore = volatileStore;
        this.defaultTtl = defaultTtl;
        this.promotionThreshold = promotionThreshold;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        durableHits = meterRegistry.counter("speaker.cache.hits", "source", "durable");
        volatileHits = meterRegistry.counter("speaker.cache.hits", "source", "volatile");
        misses = meterRegistry.counter("speaker.cache.misses");
        fallbackWrites = meterRegistry.counter("speaker.cache.fallback.writes");
        corruptReads = meterRegistry.counter("speaker.cache.corrupt");
        reconciledKeys = meterRegistry.counter("speaker.cache.reconciled");
        meterRegistry.gauge(
                "speaker.cache.volatile.entries",
                volatileStore,
                VolatileSpeakerEmbeddingStore::size);

        SpeakerEmbeddingStore primary = durableStores.get(CacheTier.PRIMARY);
        SpeakerEmbeddingStore secondary = durableStores.get(CacheTier.SECONDARY);
        if (primary.connect()) {
            activeTier.set(CacheTier.PRIMARY);
            LOG.infof("Speaker cache using primary backend %s", primary.name());
            return;
        }
        LOG.warnf(
                "Primary speaker cache backend %s failed, trying %s",
                primary.name(), secondary.name());
        if (secondary.connect()) {
            activeTier.set(CacheTier.SECONDARY);
            LOG.infof("Speaker cache using alternative backend %s", secondary.name());
            return;
        }
        activeTier.set(CacheTier.VOLATILE);
        LOG.warn("All speaker cache backends failed, using in-memory cache only");
    }

    public boolean setEmbedding(String userKey, SpeakerEmbedding embedding) {
        return setEmbedding(userKey, embedding, defaultTtl);
    }

    /**
     * Store {@code embedding} for {@code userKey}, replacing any previous one. Always succeeds: if
     * no durable backend accepts the write the embedding is kept in process memory.
     */
    public boolean setEmbedding(String userKey, SpeakerEmbedding embedding, Duration ttl) {
        requireKey(userKey);
        if (embedding == null) {
            throw new IllegalArgumentException("embedding must not be null");
        }
        CacheEntry.requirePositive(ttl);

        Lock shared = promotionLock.readLock();
        shared.lock();
        try {
            Optional<Served<Boolean>> durable =
                    onDurable("set", userKey, store -> store.set(userKey, embedding, ttl));
            CacheTier landed;
            if (durable.isPresent() && durable.get().result().isOk()) {
                // Drop any earlier fallback copy so it cannot outlive the durable entry.
                volatileStore.remove(userKey);
                landed = durable.get().tier();
            } else {
                volatileStore.put(userKey, embedding, ttl);
                fallbackWrites.increment();
                LOG.debugf("Stored speaker embedding for %s in memory", userKey);
                landed = CacheTier.VOLATILE;
            }
            if (landed != CacheTier.PRIMARY) {
                pendingWrites.put(userKey, new PendingWrite(landed, clock.instant().plus(ttl)));
            }
            return true;
        } finally {
            shared.unlock();
        }
    }

    /**
     * Durable backend first, then process memory. A corrupt durable entry has already been
     * removed by the store and is reported as absent here.
     */
    public Optional<SpeakerEmbedding> getEmbedding(String userKey) {
        requireKey(userKey);
        Optional<Served<Optional<SpeakerEmbedding>>> durable =
                onDurable("get", userKey, store -> store.get(userKey));
        if (durable.isPresent()) {
            BackendResult<Optional<SpeakerEmbedding>> result = durable.get().result();
            if (result.isOk() && result.value().isPresent()) {
                durableHits.increment();
                return result.value();
            }
            if (result.error() == BackendError.CORRUPT) {
                corruptReads.increment();
            }
        }
        Optional<SpeakerEmbedding> fallback = volatileStore.get(userKey);
        if (fallback.isPresent()) {
            volatileHits.increment();
        } else {
            misses.increment();
            LOG.debugf("No speaker embedding cached for %s", userKey);
        }
        return fallback;
    }

    /** @return true if either the durable backend or process memory held an entry */
    public boolean deleteEmbedding(String userKey) {
        requireKey(userKey);
        Lock shared = promotionLock.readLock();
        shared.lock();
        try {
            Optional<Served<Boolean>> durable =
                    onDurable("delete", userKey, store -> store.delete(userKey));
            boolean deleted =
                    durable.map(served -> served.result().orElse(Boolean.FALSE))
                            .orElse(Boolean.FALSE);
            if (volatileStore.remove(userKey)) {
                deleted = true;
            }
            if (durable.isEmpty() || durable.get().tier() != CacheTier.PRIMARY) {
                pendingWrites.put(userKey, PendingWrite.DELETED);
            }
            return deleted;
        } finally {
            shared.unlock();
        }
    }

    public boolean existsEmbedding(String userKey) {
        requireKey(userKey);
        boolean durable =
                onDurable("exists", userKey, store -> store.exists(userKey))
                        .map(served -> served.result().orElse(Boolean.FALSE))
                        .orElse(Boolean.FALSE);
        return durable || volatileStore.contains(userKey);
    }

    /**
     * Remove expired entries from the active durable backend and from process memory.
     *
     * @return total number of entries removed
     */
    public long cleanupExpired() {
        long removed =
                onDurable("sweepExpired", "*", SpeakerEmbeddingStore::sweepExpired)
                        .map(served -> served.result().orElse(0L))
                        .orElse(0L);
        removed += volatileStore.sweepExpired();
        if (removed > 0) {
            LOG.infof("Removed %d expired speaker embeddings", removed);
        }
        return removed;
    }

    public SpeakerEmbedding getCachedEmbeddingOrFail(String userKey) {
        return getEmbedding(userKey)
                .orElseThrow(() -> new SpeakerEmbeddingNotFoundException(userKey));
    }

    public CacheInfo getCacheInfo() {
        CacheTier tier = activeTier.get();
        SpeakerEmbeddingStore store = durableStores.get(tier);
        Map<String, Map<String, Object>> backends = new LinkedHashMap<>();
        for (SpeakerEmbeddingStore durable : durableStores.values()) {
            backends.put(durable.name(), durable.describe());
        }
        boolean connected = store != null && store.available();
        return new CacheInfo(
                configuredBackend,
                store == null ? CacheInfo.VOLATILE_LABEL : store.name(),
                tier,
                connected ? CacheInfo.STATUS_CONNECTED : CacheInfo.STATUS_FALLBACK_ONLY,
                volatileStore.size(),
                backends);
    }

    public CacheTier getActiveTier() {
        return activeTier.get();
    }

    /**
     * Probe every durable tier preferred over the active one and promote the best tier that has
     * been healthy for {@code promotionThreshold} consecutive probes. Promotion is abandoned, and
     * the probe count reset, if reconciling the keys written during the outage fails.
     *
     * @return the tier active after probing
     */
    public CacheTier reprobe() {
        CacheTier current = activeTier.get();
        for (CacheTier tier : new CacheTier[] {CacheTier.PRIMARY, CacheTier.SECONDARY}) {
            if (!tier.isPreferredOver(current)) {
                break;
            }
            SpeakerEmbeddingStore store = durableStores.get(tier);
            if (!store.connect()) {
                recordProbe(tier, false);
                continue;
            }
            int healthy = recordProbe(tier, true);
            LOG.debugf(
                    "Speaker cache backend %s healthy (%d/%d)",
                    store.name(), healthy, promotionThreshold);
            if (healthy >= promotionThreshold && promote(current, tier)) {
                return tier;
            }
        }
        return activeTier.get();
    }

    private boolean promote(CacheTier from, CacheTier to) {
        Lock exclusive = promotionLock.writeLock();
        exclusive.lock();
        try {
            if (activeTier.get() != from) {
                return false;
            }
            int reconciled = reconcile(to);
            if (reconciled < 0) {
                recordProbe(to, false);
                return false;
            }
            if (!activeTier.compareAndSet(from, to)) {
                return false;
            }
            if (to == CacheTier.PRIMARY) {
                pendingWrites.clear();
            }
            resetProbes();
            tierChanged(from, to, "recovered, " + reconciled + " keys reconciled");
            return true;
        } finally {
            exclusive.unlock();
        }
    }

    /** @return number of keys reconciled onto {@code to}, or -1 if {@code to} failed again */
    private int reconcile(CacheTier to) {
        SpeakerEmbeddingStore target = durableStores.get(to);
        int reconciled = 0;
        for (Map.Entry<String, PendingWrite> pending : pendingWrites.entrySet()) {
            String userKey = pending.getKey();
            BackendResult<Boolean> result = writeBack(target, to, userKey, pending.getValue());
            if (result.isFailed() && result.error().isConnectivityFailure()) {
                LOG.warnf(
                        "Reconciling %s onto %s failed (%s), staying on %s",
                        userKey, target.name(), result.error(), label(activeTier.get()));
                return -1;
            }
            reconciled++;
            reconciledKeys.increment();
        }
        return reconciled;
    }

    private BackendResult<Boolean> writeBack(
            SpeakerEmbeddingStore target, CacheTier to, String userKey, PendingWrite pending) {
        if (pending.deleted()) {
            return target.delete(userKey);
        }
        if (pending.landed() == to) {
            return BackendResult.ok(Boolean.TRUE);
        }
        Instant now = clock.instant();
        Optional<SpeakerEmbedding> latest =
                pending.expiresAt().isAfter(now)
                        ? readFrom(pending.landed(), userKey)
                        : Optional.empty();
        if (latest.isEmpty()) {
            // Expired or no longer readable: the promoted tier must not serve its older copy.
            return target.delete(userKey);
        }
        BackendResult<Boolean> result =
                target.set(userKey, latest.get(), Duration.between(now, pending.expiresAt()));
        if (result.isOk()) {
            if (pending.landed() == CacheTier.VOLATILE) {
                volatileStore.remove(userKey);
            }
            pendingWrites.put(userKey, new PendingWrite(to, pending.expiresAt()));
        }
        return result;
    }

    private Optional<SpeakerEmbedding> readFrom(CacheTier tier, String userKey) {
        if (!tier.isDurable()) {
            return volatileStore.get(userKey);
        }
        SpeakerEmbeddingStore store = durableStores.get(tier);
        if (!store.available()) {
            return Optional.empty();
        }
        return store.get(userKey).orElse(Optional.empty());
    }

    private <T> Optional<Served<T>> onDurable(
            String operation,
            String userKey,
            Function<SpeakerEmbeddingStore, BackendResult<T>> call) {
        for (int attempt = 0; attempt < CacheTier.values().length; attempt++) {
            CacheTier tier = activeTier.get();
            SpeakerEmbeddingStore store = durableStores.get(tier);
            if (store == null) {
                return Optional.empty();
            }
            if (!store.available()) {
                demote(tier, store.name() + " unavailable");
                continue;
            }
            BackendResult<T> result = call.apply(store);
            if (result.isFailed() && result.error().isConnectivityFailure()) {
                demote(
                        tier,
                        store.name() + " " + operation + " for " + userKey + " " + result.error());
                continue;
            }
            return Optional.of(new Served<>(tier, result));
        }
        return Optional.empty();
    }

    private void demote(CacheTier from, String reason) {
        CacheTier next = CacheTier.VOLATILE;
        if (from == CacheTier.PRIMARY) {
            SpeakerEmbeddingStore secondary = durableStores.get(CacheTier.SECONDARY);
            if (secondary.available() || secondary.connect()) {
                next = CacheTier.SECONDARY;
            }
        }
        if (from != CacheTier.VOLATILE && activeTier.compareAndSet(from, next)) {
            resetProbes();
            tierChanged(from, next, reason);
        }
    }

    private void tierChanged(CacheTier from, CacheTier to, String reason) {
        meterRegistry
                .counter("speaker.cache.tier.changes", "from", label(from), "to", label(to))
                .increment();
        if (to.isPreferredOver(from)) {
            LOG.infof("Speaker cache promoted from %s to %s (%s)", label(from), label(to), reason);
        } else {
            LOG.warnf("Speaker cache demoted from %s to %s (%s)", label(from), label(to), reason);
        }
    }

    private String label(CacheTier tier) {
        SpeakerEmbeddingStore store = durableStores.get(tier);
        return store == null ? CacheInfo.VOLATILE_LABEL : store.name();
    }

    private int recordProbe(CacheTier tier, boolean healthy) {
        synchronized (healthyProbes) {
            int count = healthy ? healthyProbes.getOrDefault(tier, 0) + 1 : 0;
            healthyProbes.put(tier, count);
            return count;
        }
    }

    private void resetProbes() {
        synchronized (healthyProbes) {
            healthyProbes.clear();
        }
    }

    private static void requireKey(String userKey) {
        if (userKey == null || userKey.isBlank()) {
            throw new IllegalArgumentException("userKey must not be blank");
        }
    }

    private record Served<T>(CacheTier tier, BackendResult<T> result) {}

    /** Last write to a key made while the primary tier was not active. */
    private record PendingWrite(CacheTier landed, Instant expiresAt) {
        static final PendingWrite DELETED = new PendingWrite(null, null);

        boolean deleted() {
            return expiresAt == null;
        }
    }
}
