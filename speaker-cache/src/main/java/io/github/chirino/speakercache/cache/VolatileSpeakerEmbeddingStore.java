package io.github.chirino.speakercache.cache;

import io.github.chirino.speakercache.codec.SpeakerEmbedding;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process local last resort used when no durable backend can take a write. Entries hold the
 * embedding itself (no serialization) and the same expiry a durable write would have had. They are
 * lost on restart.
 *
 * <p>All access goes through one lock that is only held for the map operation itself; callers must
 * never hold it across a durable backend call.
 */
public class VolatileSpeakerEmbeddingStore {

    private record Slot(SpeakerEmbedding embedding, Instant expiresAt) {}

    private final Map<String, Slot> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    public VolatileSpeakerEmbeddingStore(Clock clock) {
        this.clock = clock;
    }

    public void put(String userKey, SpeakerEmbedding embedding, Duration ttl) {
        CacheEntry.requirePositive(ttl);
        Slot slot = new Slot(embedding, clock.instant().plus(ttl));
        lock.lock();
        try {
            entries.put(userKey, slot);
        } finally {
            lock.unlock();
        }
    }

    public Optional<SpeakerEmbedding> get(String userKey) {
        Instant now = clock.instant();
        lock.lock();
        try {
            Slot slot = entries.get(userKey);
            if (slot == null) {
                return Optional.empty();
            }
            if (now.isAfter(slot.expiresAt())) {
                entries.remove(userKey);
                return Optional.empty();
            }
            return Optional.of(slot.embedding());
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String userKey) {
        return get(userKey).isPresent();
    }

    /** @return true if a non-expired entry was removed */
    public boolean remove(String userKey) {
        Instant now = clock.instant();
        lock.lock();
        try {
            Slot removed = entries.remove(userKey);
            return removed != null && !now.isAfter(removed.expiresAt());
        } finally {
            lock.unlock();
        }
    }

    public long sweepExpired() {
        Instant now = clock.instant();
        long removed = 0;
        lock.lock();
        try {
            Iterator<Slot> it = entries.values().iterator();
            while (it.hasNext()) {
                if (now.isAfter(it.next().expiresAt())) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        return removed;
    }

    /** Number of physically held entries, including expired ones not yet swept. */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }
}
