package io.github.chirino.speakercache.cache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Reports which tier serves speaker embeddings. Running from process memory is a degraded state,
 * not an outage, so the check stays UP and only the data shows the fallback.
 */
@Readiness
@ApplicationScoped
public class SpeakerCacheHealthCheck implements HealthCheck {

    static final String NAME = "Speaker cache";

    @Inject TieredCacheManager cacheManager;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named(NAME);
        try {
            CacheInfo info = cacheManager.getCacheInfo();
            return builder.up()
                    .withData("configuredBackend", info.configuredBackend())
                    .withData("activeBackend", info.activeBackend())
                    .withData("activeTier", info.activeTier().name())
                    .withData("status", info.status())
                    .withData("volatileEntries", info.volatileEntries())
                    .build();
        } catch (Exception e) {
            return builder.down().withData("error", String.valueOf(e.getMessage())).build();
        }
    }
}
