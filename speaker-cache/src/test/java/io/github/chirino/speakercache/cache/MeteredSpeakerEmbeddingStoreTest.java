package io.github.chirino.speakercache.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.chirino.speakercache.codec.SpeakerEmbedding;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class MeteredSpeakerEmbeddingStoreTest {

    private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    private final InMemorySpeakerEmbeddingStore delegate =
            new InMemorySpeakerEmbeddingStore("redis", clock);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MeteredSpeakerEmbeddingStore store =
            new MeteredSpeakerEmbeddingStore(registry, delegate);

    @Test
    void timesEachOperationPerBackend() {
        assertTrue(store.connect());
        store.set("u1", SpeakerEmbedding.of(1.0), Duration.ofMinutes(1));
        store.get("u1");
        store.get("u2");

        assertEquals(
                1,
                registry.timer(
                                "speaker.cache.store.operation",
                                "backend",
                                "redis",
                                "operation",
                                "connect")
                        .count());
        assertEquals(
                2,
                registry.timer(
                                "speaker.cache.store.operation",
                                "backend",
                                "redis",
                                "operation",
                                "get")
                        .count());
        assertNull(registry.find("speaker.cache.store.errors").counter());
    }

    @Test
    void countsFailuresByError() {
        store.connect();
        delegate.failNext(2, BackendError.TIMEOUT);

        assertEquals(BackendError.TIMEOUT, store.exists("u1").error());
        assertEquals(BackendError.TIMEOUT, store.delete("u1").error());

        assertEquals(
                1.0,
                registry.counter(
                                "speaker.cache.store.errors",
                                "backend",
                                "redis",
                                "operation",
                                "exists",
                                "error",
                                "timeout")
                        .count());
        assertFalse(store.available());
    }

    @Test
    void passesThroughIdentity() {
        assertEquals("redis", store.name());
        assertSame(delegate, store.getDelegate());
        assertEquals(delegate.describe(), store.describe());
        assertFalse(store.nativeExpiration());
    }
}
