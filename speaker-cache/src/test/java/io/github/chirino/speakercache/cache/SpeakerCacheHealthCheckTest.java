package io.github.chirino.speakercache.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.Test;

class SpeakerCacheHealthCheckTest {

    private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    private final InMemorySpeakerEmbeddingStore redis =
            new InMemorySpeakerEmbeddingStore("redis", clock);
    private final InMemorySpeakerEmbeddingStore mongo =
            new InMemorySpeakerEmbeddingStore("mongodb", clock);

    private SpeakerCacheHealthCheck createCheck() {
        TieredCacheManager manager =
                new TieredCacheManager(
                        "redis",
                        redis,
                        mongo,
                        new VolatileSpeakerEmbeddingStore(clock),
                        Duration.ofDays(30),
                        3,
                        new SimpleMeterRegistry(),
                        clock);
        manager.init();
        SpeakerCacheHealthCheck check = new SpeakerCacheHealthCheck();
        check.cacheManager = manager;
        return check;
    }

    @Test
    void upWithPrimaryBackend() {
        HealthCheckResponse response = createCheck().call();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals("redis", response.getData().orElseThrow().get("activeBackend"));
        assertEquals("PRIMARY", response.getData().orElseThrow().get("activeTier"));
    }

    @Test
    void staysUpWhenOnlyMemoryIsLeft() {
        redis.setReachable(false);
        mongo.setReachable(false);

        HealthCheckResponse response = createCheck().call();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals("volatile", response.getData().orElseThrow().get("activeBackend"));
        assertEquals(
                CacheInfo.STATUS_FALLBACK_ONLY, response.getData().orElseThrow().get("status"));
    }

    @Test
    void downWhenCacheInfoFails() {
        SpeakerCacheHealthCheck check = new SpeakerCacheHealthCheck();
        check.cacheManager = mock(TieredCacheManager.class);
        when(check.cacheManager.getCacheInfo()).thenThrow(new IllegalStateException("boom"));

        HealthCheckResponse response = check.call();

        assertEquals(HealthCheckResponse.Status.DOWN, response.getStatus());
        assertEquals(SpeakerCacheHealthCheck.NAME, response.getName());
    }
}
