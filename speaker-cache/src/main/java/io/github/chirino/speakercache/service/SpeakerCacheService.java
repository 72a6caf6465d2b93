package io.github.chirino.speakercache.service;

import io.github.chirino.speakercache.cache.CacheInfo;
import io.github.chirino.speakercache.cache.SpeakerEmbeddingNotFoundException;
import io.github.chirino.speakercache.cache.TieredCacheManager;
import io.github.chirino.speakercache.codec.SpeakerEmbedding;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Operations offered to the audio generation workflow. Callers populate the cache with {@link
 * #cacheVoice(String)} once per user and then read it with {@link #fetchOrFail(String)} on every
 * request.
 */
@ApplicationScoped
public class SpeakerCacheService {

    private static final Logger LOG = Logger.getLogger(SpeakerCacheService.class);

    @Inject TieredCacheManager cacheManager;

    @Inject Instance<VoiceSampleLocator> voiceSampleLocator;

    @Inject Instance<SpeakerEmbeddingExtractor> embeddingExtractor;

    /**
     * Compute the user's speaker embedding from their voice sample and cache it.
     *
     * @throws VoiceSampleNotFoundException if the user has no voice sample
     */
    public CacheVoiceResult cacheVoice(String userKey) {
        String samplePath =
                require(voiceSampleLocator, VoiceSampleLocator.class)
                        .findVoiceSample(userKey)
                        .orElseThrow(() -> new VoiceSampleNotFoundException(userKey));
        SpeakerEmbedding embedding =
                require(embeddingExtractor, SpeakerEmbeddingExtractor.class).extract(samplePath);
        return cacheEmbedding(userKey, embedding);
    }

    /** Cache an embedding the caller already computed. */
    public CacheVoiceResult cacheEmbedding(String userKey, SpeakerEmbedding embedding) {
        boolean success = cacheManager.setEmbedding(userKey, embedding);
        CacheInfo info = cacheManager.getCacheInfo();
        LOG.infof(
                "Cached speaker embedding for %s (dimension %d) in %s",
                userKey, embedding.dimension(), info.activeBackend());
        return new CacheVoiceResult(
                userKey,
                success,
                info.activeBackend(),
                "Speaker embedding cached for user " + userKey);
    }

    public CacheStatus checkStatus(String userKey) {
        boolean exists = cacheManager.existsEmbedding(userKey);
        String message =
                exists
                        ? "Speaker embedding found"
                        : "Speaker embedding not found. Call "
                                + SpeakerEmbeddingNotFoundException.POPULATE_OPERATION
                                + " first.";
        return new CacheStatus(userKey, exists, message, cacheManager.getCacheInfo());
    }

    public ClearResult clear(String userKey) {
        boolean deleted = cacheManager.deleteEmbedding(userKey);
        return new ClearResult(
                userKey,
                deleted,
                "Speaker embedding "
                        + (deleted ? "cleared" : "not found")
                        + " for user "
                        + userKey);
    }

    public SweepResult cleanupSweep() {
        long removed = cacheManager.cleanupExpired();
        return new SweepResult(removed, "Cleaned up " + removed + " expired entries");
    }

    /**
     * @throws SpeakerEmbeddingNotFoundException if nothing is cached for {@code userKey}
     */
    public SpeakerEmbedding fetchOrFail(String userKey) {
        return cacheManager.getCachedEmbeddingOrFail(userKey);
    }

    private static <T> T require(Instance<T> instance, Class<T> type) {
        if (instance.isUnsatisfied()) {
            throw new IllegalStateException("No " + type.getSimpleName() + " bean is available");
        }
        return instance.get();
    }
}
