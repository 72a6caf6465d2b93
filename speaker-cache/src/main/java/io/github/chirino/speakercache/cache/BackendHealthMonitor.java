package io.github.chirino.speakercache.cache;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/** Periodically re-probes demoted durable backends so the cache can move back up a tier. */
@ApplicationScoped
public class BackendHealthMonitor {

    private static final Logger LOG = Logger.getLogger(BackendHealthMonitor.class);

    @Inject TieredCacheManager cacheManager;

    @ConfigProperty(name = "speaker-cache.health.reprobe-enabled", defaultValue = "true")
    boolean reprobeEnabled;

    @Scheduled(
            every = "${speaker-cache.health.probe-interval:30s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void probeDemotedBackends() {
        if (!reprobeEnabled || cacheManager.getActiveTier() == CacheTier.PRIMARY) {
            return;
        }
        CacheTier before = cacheManager.getActiveTier();
        try {
            CacheTier after = cacheManager.reprobe();
            if (after != before) {
                LOG.infof("Speaker cache tier changed from %s to %s after re-probe", before, after);
            }
        } catch (Exception e) {
            LOG.warnf("Speaker cache re-probe failed: %s", e.getMessage());
        }
    }
}
