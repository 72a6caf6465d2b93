package io.github.chirino.speakercache.config;

import io.github.chirino.speakercache.cache.MeteredSpeakerEmbeddingStore;
import io.github.chirino.speakercache.cache.MongoSpeakerEmbeddingStore;
import io.github.chirino.speakercache.cache.RedisSpeakerEmbeddingStore;
import io.github.chirino.speakercache.cache.SpeakerEmbeddingStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Orders the durable speaker cache backends: the configured one becomes the primary, the other one
 * the secondary. Both are wrapped with metrics.
 */
@ApplicationScoped
public class CacheBackendSelector {
    private static final Logger LOG = Logger.getLogger(CacheBackendSelector.class);

    public static final String REDIS = "redis";
    public static final String MONGODB = "mongodb";

    @ConfigProperty(name = "speaker-cache.backend", defaultValue = REDIS)
    String backendType;

    @Inject Instance<RedisSpeakerEmbeddingStore> redisStore;

    @Inject Instance<MongoSpeakerEmbeddingStore> mongoStore;

    @Inject MeterRegistry meterRegistry;

    private String configuredBackend;
    private SpeakerEmbeddingStore primary;
    private SpeakerEmbeddingStore secondary;

    @PostConstruct
    void init() {
        configuredBackend = normalize(backendType);
        SpeakerEmbeddingStore redis =
                new MeteredSpeakerEmbeddingStore(meterRegistry, redisStore.get());
        SpeakerEmbeddingStore mongo =
                new MeteredSpeakerEmbeddingStore(meterRegistry, mongoStore.get());
        if (MONGODB.equals(configuredBackend)) {
            primary = mongo;
            secondary = redis;
        } else {
            primary = redis;
            secondary = mongo;
        }
    }

    public String getConfiguredBackend() {
        return configuredBackend;
    }

    public SpeakerEmbeddingStore getPrimary() {
        return primary;
    }

    public SpeakerEmbeddingStore getSecondary() {
        return secondary;
    }

    static String normalize(String type) {
        String value = type == null ? REDIS : type.trim().toLowerCase();
        return switch (value) {
            case "redis", "backend_a" -> REDIS;
            case "mongo", "mongodb", "backend_b" -> MONGODB;
            default -> {
                LOG.warnf("Unknown speaker-cache.backend '%s', using %s", type, REDIS);
                yield REDIS;
            }
        };
    }
}
