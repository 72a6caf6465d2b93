package io.github.chirino.speakercache.cache;

import io.github.chirino.speakercache.codec.SpeakerEmbedding;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Decorator that records every store call with a Micrometer timer named
 * "speaker.cache.store.operation", tagged with the backend and the operation. Failed calls also
 * increment "speaker.cache.store.errors", tagged with the {@link BackendError}.
 */
public class MeteredSpeakerEmbeddingStore implements SpeakerEmbeddingStore {

    private final MeterRegistry registry;
    private final SpeakerEmbeddingStore delegate;

    public MeteredSpeakerEmbeddingStore(MeterRegistry registry, SpeakerEmbeddingStore delegate) {
        this.registry = registry;
        this.delegate = delegate;
    }

    public SpeakerEmbeddingStore getDelegate() {
        return delegate;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public boolean connect() {
        Supplier<Boolean> probe = delegate::connect;
        Boolean connected =
                registry.timer(
                                "speaker.cache.store.operation",
                                "backend",
                                delegate.name(),
                                "operation",
                                "connect")
                        .record(probe);
        return Boolean.TRUE.equals(connected);
    }

    @Override
    public boolean available() {
        return delegate.available();
    }

    @Override
    public boolean nativeExpiration() {
        return delegate.nativeExpiration();
    }

    @Override
    public BackendResult<Boolean> set(String userKey, SpeakerEmbedding embedding, Duration ttl) {
        return record("set", () -> delegate.set(userKey, embedding, ttl));
    }

    @Override
    public BackendResult<Optional<SpeakerEmbedding>> get(String userKey) {
        return record("get", () -> delegate.get(userKey));
    }

    @Override
    public BackendResult<Boolean> delete(String userKey) {
        return record("delete", () -> delegate.delete(userKey));
    }

    @Override
    public BackendResult<Boolean> exists(String userKey) {
        return record("exists", () -> delegate.exists(userKey));
    }

    @Override
    public BackendResult<Long> sweepExpired() {
        return record("sweepExpired", delegate::sweepExpired);
    }

    @Override
    public Map<String, Object> describe() {
        return delegate.describe();
    }

    private <T> BackendResult<T> record(String operation, Supplier<BackendResult<T>> call) {
        BackendResult<T> result =
                registry.timer(
                                "speaker.cache.store.operation",
                                "backend",
                                delegate.name(),
                                "operation",
                                operation)
                        .record(call);
        if (result != null && result.isFailed()) {
            registry.counter(
                            "speaker.cache.store.errors",
                            "backend",
                            delegate.name(),
                            "operation",
                            operation,
                            "error",
                            result.error().name().toLowerCase())
                    .increment();
        }
        return result;
    }
}
