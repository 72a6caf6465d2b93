package io.github.chirino.speakercache.cache;

import io.github.chirino.speakercache.codec.SpeakerEmbedding;
import io.github.chirino.speakercache.codec.SpeakerEmbeddingCodec;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Durable store stand-in for manager tests. Reachability can be switched at runtime and a number
 * of upcoming calls can be made to fail with a chosen {@link BackendError}.
 */
public class InMemorySpeakerEmbeddingStore implements SpeakerEmbeddingStore {

    private final String name;
    private final SpeakerEmbeddingCodec codec;
    private final Clock clock;
    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final AtomicInteger connectAttempts = new AtomicInteger();
    private final AtomicInteger failuresRemaining = new AtomicInteger();
    private volatile BackendError failureType = BackendError.UNREACHABLE;
    private volatile boolean reachable = true;
    private volatile boolean connected;

    public InMemorySpeakerEmbeddingStore(String name, Clock clock) {
        this.name = name;
        this.codec = new SpeakerEmbeddingCodec(0);
        this.clock = clock;
    }

    public void setReachable(boolean reachable) {
        this.reachable = reachable;
        if (!reachable) {
            connected = false;
        }
    }

    public void failNext(int calls, BackendError error) {
        failureType = error;
        failuresRemaining.set(calls);
    }

    public int connectAttempts() {
        return connectAttempts.get();
    }

    public int size() {
        return entries.size();
    }

    public boolean holds(String userKey) {
        return entries.containsKey(userKey);
    }

    public void putRaw(CacheEntry entry) {
        entries.put(entry.userKey(), entry);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean connect() {
        connectAttempts.incrementAndGet();
        connected = reachable;
        return connected;
    }

    @Override
    public boolean available() {
        return connected;
    }

    @Override
    public boolean nativeExpiration() {
        return false;
    }

    @Override
    public BackendResult<Boolean> set(String userKey, SpeakerEmbedding embedding, Duration ttl) {
        BackendResult<Boolean> failure = checkFailure();
        if (failure != null) {
            return failure;
        }
        entries.put(
                userKey, CacheEntry.create(userKey, codec.encode(embedding), clock.instant(), ttl));
        return BackendResult.ok(Boolean.TRUE);
    }

    @Override
    public BackendResult<Optional<SpeakerEmbedding>> get(String userKey) {
        BackendResult<Optional<SpeakerEmbedding>> failure = checkFailure();
        if (failure != null) {
            return failure;
        }
        CacheEntry entry = entries.get(userKey);
        if (entry == null) {
            return BackendResult.ok(Optional.empty());
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(userKey);
            return BackendResult.ok(Optional.empty());
        }
        try {
            return BackendResult.ok(Optional.of(codec.decode(entry.payload())));
        } catch (RuntimeException e) {
            entries.remove(userKey);
            return BackendResult.failed(BackendError.CORRUPT);
        }
    }

    @Override
    public BackendResult<Boolean> delete(String userKey) {
        BackendResult<Boolean> failure = checkFailure();
        if (failure != null) {
            return failure;
        }
        return BackendResult.ok(entries.remove(userKey) != null);
    }

    @Override
    public BackendResult<Boolean> exists(String userKey) {
        BackendResult<Boolean> failure = checkFailure();
        if (failure != null) {
            return failure;
        }
        CacheEntry entry = entries.get(userKey);
        if (entry == null) {
            return BackendResult.ok(Boolean.FALSE);
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(userKey);
            return BackendResult.ok(Boolean.FALSE);
        }
        return BackendResult.ok(Boolean.TRUE);
    }

    @Override
    public BackendResult<Long> sweepExpired() {
        BackendResult<Long> failure = checkFailure();
        if (failure != null) {
            return failure;
        }
        long before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(clock.instant()));
        return BackendResult.ok(before - entries.size());
    }

    @Override
    public Map<String, Object> describe() {
        return Map.of("type", name, "status", connected ? "connected" : "disconnected");
    }

    private <T> BackendResult<T> checkFailure() {
        if (!reachable) {
            connected = false;
            return BackendResult.failed(BackendError.UNREACHABLE);
        }
        if (failuresRemaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            if (failureType.isConnectivityFailure()) {
                connected = false;
            }
            return BackendResult.failed(failureType);
        }
        return null;
    }
}
