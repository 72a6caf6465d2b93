package io.github.chirino.speakercache.cache;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

@ApplicationScoped
public class ExpiredEmbeddingSweepJob {

    private static final Logger LOG = Logger.getLogger(ExpiredEmbeddingSweepJob.class);

    @Inject TieredCacheManager cacheManager;

    @Scheduled(
            every = "${speaker-cache.sweep.interval:1h}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void sweepExpiredEmbeddings() {
        try {
            long removed = cacheManager.cleanupExpired();
            LOG.debugf("Expired speaker embedding sweep removed %d entries", removed);
        } catch (Exception e) {
            LOG.warnf("Expired speaker embedding sweep failed: %s", e.getMessage());
        }
    }
}
